package ca.gc.dfo.tides.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void trimsNonBlankValues() {
    assertEquals("M2", Strings.requireNonBlank("name", "  M2 "));
  }

  @Test
  void rejectsBlankOrControlCharacters() {
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("name", null));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "M2\u0000"));
  }

  @Test
  void splitsIdentifierListsInOrder() {
    assertEquals(List.of("M2", "S2", "K1"), Strings.requireIdentifierList("constituents", "M2, S2 ,K1"));
  }

  @Test
  void rejectsEmptyOrNonAlphanumericEntries() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireIdentifierList("constituents", "M2,"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireIdentifierList("constituents", "M2;S2"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireIdentifierList("constituents", "M-2"));
  }
}
