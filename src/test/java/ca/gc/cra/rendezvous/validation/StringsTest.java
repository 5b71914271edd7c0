package ca.gc.cra.rendezvous.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void requirePrintableAsciiRejectsNonAscii() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("path", "/v☃l", 16));
  }

  @Test
  void requirePrintableAsciiRejectsExcessLength() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("path", "abc", 2));
  }

  @Test
  void isUuidAcceptsCanonicalFormInEitherCase() {
    assertTrue(Strings.isUuid("3f2b8c1e-9d4a-4b7e-8a61-0c5d2e7f9a10"));
    assertTrue(Strings.isUuid("3F2B8C1E-9D4A-4B7E-8A61-0C5D2E7F9A10"));
  }

  @Test
  void isUuidRejectsOtherShapes() {
    assertFalse(Strings.isUuid(null));
    assertFalse(Strings.isUuid("3f2b8c1e9d4a4b7e8a610c5d2e7f9a10"));
    assertFalse(Strings.isUuid("3f2b8c1e-9d4a-4b7e-8a61-0c5d2e7f9a1g"));
    assertFalse(Strings.isUuid(" 3f2b8c1e-9d4a-4b7e-8a61-0c5d2e7f9a10"));
  }

  @Test
  void sanitizeForWireStripsMarkupQuotesAndControls() {
    assertEquals("scriptalert(1)/script", Strings.sanitizeForWire("<script>alert(1)</script>", 1024));
    assertEquals("a\tb", Strings.sanitizeForWire("a\tb\r\n\0\u001a", 1024));
    assertEquals("its", Strings.sanitizeForWire("it's`\"", 1024));
  }

  @Test
  void sanitizeForWireDropsNonAsciiAndTruncates() {
    assertEquals("caf", Strings.sanitizeForWire("café", 1024));
    assertEquals("CA", Strings.sanitizeForWire("CANADA", 2));
    assertEquals("", Strings.sanitizeForWire(null, 10));
  }

  @Test
  void sanitizeForWireTrimsResult() {
    assertEquals("ok", Strings.sanitizeForWire("  ok \n", 1024));
  }
}
