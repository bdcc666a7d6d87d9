package io.kalends;

import static org.junit.jupiter.api.Assertions.*;

import io.kalends.engine.GregorianEngine;
import io.kalends.engine.HebrewEngine;
import org.junit.jupiter.api.Test;

/** Unit tests for the Calendars facade. */
public class CalendarsTest {

  @Test
  void testEngineLookup() throws CalendarException {
    assertSame(GregorianEngine.INSTANCE, Calendars.engine(CalendarKind.GREGORIAN));
    assertSame(HebrewEngine.INSTANCE, Calendars.engine(CalendarKind.HEBREW));
    for (CalendarKind kind : CalendarKind.values()) {
      assertEquals(kind, Calendars.engine(kind).kind());
    }
  }

  @Test
  void testEngineRejectsMissingCalendar() {
    CalendarException e = assertThrows(CalendarException.class, () -> Calendars.engine(null));
    assertEquals(ErrorKind.UNSUPPORTED_CALENDAR, e.kind());
  }

  @Test
  void testConvert() throws CalendarException {
    CivilDate date = CivilDate.of(1792, 9, 22, CalendarKind.GREGORIAN);
    assertEquals(
        CivilDate.of(1, 1, 1, CalendarKind.FRENCH_REPUBLICAN),
        Calendars.convert(date, CalendarKind.FRENCH_REPUBLICAN));
    assertEquals(
        CivilDate.of(5553, 1, 6, CalendarKind.HEBREW),
        Calendars.convert(date, CalendarKind.HEBREW));
  }

  @Test
  void testValidate() {
    assertTrue(Calendars.validate(2000, 2, 29, CalendarKind.GREGORIAN));
    assertFalse(Calendars.validate(1900, 2, 29, CalendarKind.GREGORIAN));
    assertTrue(Calendars.validate(1900, 2, 29, CalendarKind.JULIAN));
    assertTrue(Calendars.validate(3, 13, 6, CalendarKind.FRENCH_REPUBLICAN));
    assertFalse(Calendars.validate(4, 13, 6, CalendarKind.FRENCH_REPUBLICAN));
    assertFalse(Calendars.validate(5785, 13, 1, CalendarKind.HEBREW));
    assertFalse(Calendars.validate(2000, 1, 1, null));
  }

  @Test
  void testDetectYear() {
    assertEquals(CalendarKind.HEBREW, Calendars.detect(5785));
    assertEquals(CalendarKind.FRENCH_REPUBLICAN, Calendars.detect(1792));
    assertEquals(CalendarKind.FRENCH_REPUBLICAN, Calendars.detect(1805));
    assertEquals(CalendarKind.GREGORIAN, Calendars.detect(1806));
    assertEquals(CalendarKind.GREGORIAN, Calendars.detect(1582));
    assertEquals(CalendarKind.JULIAN, Calendars.detect(1581));
    assertEquals(CalendarKind.GREGORIAN, Calendars.detect(5000));
  }

  @Test
  void testDetectDateKeepsExplicitCalendar() throws CalendarException {
    assertEquals(
        CalendarKind.JULIAN, Calendars.detect(CivilDate.of(1995, 8, 15, CalendarKind.JULIAN)));
    assertEquals(
        CalendarKind.FRENCH_REPUBLICAN,
        Calendars.detect(CivilDate.of(1800, 1, 1, CalendarKind.GREGORIAN)));
    assertEquals(
        CalendarKind.GREGORIAN, Calendars.detect(CivilDate.of(1900, 1, 1, CalendarKind.GREGORIAN)));
  }
}
