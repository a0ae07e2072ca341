package ca.gc.dfo.tides.infrastructure.harmonic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import org.junit.jupiter.api.Test;

class AstronomicalArgumentsTest {

  @Test
  void normalizeWrapsIntoZeroToThreeSixty() {
    assertEquals(10.0, AstronomicalArguments.normalize(370.0), 1e-12);
    assertEquals(350.0, AstronomicalArguments.normalize(-10.0), 1e-12);
    assertEquals(0.0, AstronomicalArguments.normalize(720.0), 1e-12);
  }

  @Test
  void longitudesAtJ2000MatchTheirConstants() {
    AstronomicalArguments args = AstronomicalArguments.at(ZonedDateTime.of(2000, 1, 1, 12, 0, 0, 0, ZoneOffset.UTC));

    assertEquals(218.3164477, args.s(), 1e-9);
    assertEquals(280.46646, args.h(), 1e-9);
    assertEquals(125.04452, args.n(), 1e-9);
    assertEquals(AstronomicalArguments.normalize(-125.04452), args.nPrime(), 1e-9);
  }

  @Test
  void offsetOfTheEpochIsHonoured() {
    ZonedDateTime utc = ZonedDateTime.of(2020, 6, 1, 12, 0, 0, 0, ZoneOffset.UTC);
    ZonedDateTime shifted = utc.withZoneSameInstant(ZoneOffset.ofHours(-3));

    assertEquals(AstronomicalArguments.at(utc), AstronomicalArguments.at(shifted));
  }

  @Test
  void nodalFactorsStayNearUnity() {
    for (double n = 0.0; n < 360.0; n += 15.0) {
      NodalGroup.NodalFactor m2 = NodalGroup.M2.evaluate(n);
      NodalGroup.NodalFactor k1 = NodalGroup.K1.evaluate(n);
      assertTrue(m2.f() > 0.95 && m2.f() < 1.05, "M2 f at N=" + n);
      assertTrue(Math.abs(m2.uDegrees()) < 3.0, "M2 u at N=" + n);
      assertTrue(k1.f() > 0.85 && k1.f() < 1.15, "K1 f at N=" + n);
    }
    assertEquals(NodalGroup.NodalFactor.UNITY, NodalGroup.NONE.evaluate(42.0));
  }
}
