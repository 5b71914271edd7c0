package ca.gc.cra.rendezvous.testutil;

import ca.gc.cra.rendezvous.application.port.PeerTransport;
import ca.gc.cra.rendezvous.infrastructure.json.JacksonWireCodec;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory connection handle that keeps every frame sent to it.
 */
public final class RecordingTransport implements PeerTransport {
  private static final JacksonWireCodec CODEC = new JacksonWireCodec();

  private final String remoteAddress;
  private final List<String> frames = new ArrayList<>();
  private boolean open = true;
  private boolean acceptSends = true;
  private Integer closeCode;
  private String closeReason;

  public RecordingTransport() {
    this("127.0.0.1");
  }

  public RecordingTransport(String remoteAddress) {
    this.remoteAddress = remoteAddress;
  }

  @Override
  public synchronized boolean sendText(String text) {
    if (!open || !acceptSends) {
      return false;
    }
    frames.add(text);
    return true;
  }

  @Override
  public synchronized void close(int code, String reason) {
    if (!open) {
      return;
    }
    open = false;
    closeCode = code;
    closeReason = reason;
  }

  @Override
  public synchronized boolean isOpen() {
    return open;
  }

  @Override
  public String remoteAddress() {
    return remoteAddress;
  }

  /** Makes later sends fail while the transport still reports itself open. */
  public synchronized void failSends() {
    acceptSends = false;
  }

  /** Simulates the remote side dropping the connection. */
  public synchronized void drop() {
    open = false;
  }

  public synchronized List<String> frames() {
    return List.copyOf(frames);
  }

  public synchronized Integer closeCode() {
    return closeCode;
  }

  public synchronized String closeReason() {
    return closeReason;
  }

  /**
   * Decodes every recorded frame.
   *
   * @return decoded messages in send order
   */
  @SuppressWarnings("unchecked")
  public List<Map<String, Object>> messages() {
    List<Map<String, Object>> decoded = new ArrayList<>();
    for (String frame : frames()) {
      decoded.add((Map<String, Object>) CODEC.decode(frame));
    }
    return decoded;
  }

  /**
   * Returns decoded messages of one type.
   *
   * @param type wire type name
   * @return matching messages in send order
   */
  public List<Map<String, Object>> messagesOfType(String type) {
    List<Map<String, Object>> matching = new ArrayList<>();
    for (Map<String, Object> message : messages()) {
      if (Objects.equals(type, message.get("type"))) {
        matching.add(message);
      }
    }
    return matching;
  }

  /**
   * Returns the most recent decoded message.
   *
   * @return last message
   * @throws AssertionError when nothing was sent
   */
  public Map<String, Object> lastMessage() {
    List<Map<String, Object>> all = messages();
    if (all.isEmpty()) {
      throw new AssertionError("no frames sent");
    }
    return all.get(all.size() - 1);
  }

  public synchronized void clear() {
    frames.clear();
  }
}
