package ca.gc.cra.rendezvous.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void parseHostPortHandlesHostname() {
    assertEquals("example.com:443", Net.parseHostPort("example.com:443").toString());
  }

  @Test
  void parseHostPortHandlesIpv4() {
    assertEquals("0.0.0.0:8765", Net.parseHostPort("0.0.0.0:8765").toString());
  }

  @Test
  void parseHostPortStripsIpv6Brackets() {
    Net.HostPort parsed = Net.parseHostPort("[2001:db8::1]:8443");
    assertEquals("2001:db8::1", parsed.host());
    assertEquals(8443, parsed.port());
    assertEquals("[2001:db8::1]:8443", parsed.toString());
  }

  @Test
  void parseHostPortRejectsMissingPort() {
    assertThrows(IllegalArgumentException.class, () -> Net.parseHostPort("localhost"));
  }

  @Test
  void parseHostPortRejectsInvalidPort() {
    assertThrows(IllegalArgumentException.class, () -> Net.parseHostPort("localhost:70000"));
  }

  @Test
  void parseHostPortRejectsBadOctet() {
    assertThrows(IllegalArgumentException.class, () -> Net.parseHostPort("10.0.0.256:80"));
  }

  @Test
  void isHostnameAcceptsDnsNames() {
    assertTrue(Net.isHostname("ca"));
    assertTrue(Net.isHostname("eu-west.example.org"));
  }

  @Test
  void isHostnameRejectsMalformedNames() {
    assertFalse(Net.isHostname(null));
    assertFalse(Net.isHostname(""));
    assertFalse(Net.isHostname("-ca"));
    assertFalse(Net.isHostname("c a"));
    assertFalse(Net.isHostname("<script>"));
    assertFalse(Net.isHostname("example."));
  }
}
