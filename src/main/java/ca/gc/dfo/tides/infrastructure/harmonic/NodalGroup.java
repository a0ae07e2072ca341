package ca.gc.dfo.tides.infrastructure.harmonic;

/**
 * Nodal modulation families, evaluated from the longitude of the lunar node N (degrees).
 *
 * <p>Coefficients follow Pugh, <em>Tides, Surges and Mean Sea-Level</em>, table 4.3. Compound tides combine the
 * factors of their parents.
 *
 * @since 0.1.0
 */
enum NodalGroup {
  NONE {
    @Override
    NodalFactor evaluate(double n) {
      return NodalFactor.UNITY;
    }
  },
  MM {
    @Override
    NodalFactor evaluate(double n) {
      return new NodalFactor(1.0 - 0.130 * cos(n), 0.0);
    }
  },
  MF {
    @Override
    NodalFactor evaluate(double n) {
      return new NodalFactor(
          1.043 + 0.414 * cos(n),
          -23.7 * sin(n) + 2.7 * sin(2 * n) - 0.4 * sin(3 * n));
    }
  },
  O1 {
    @Override
    NodalFactor evaluate(double n) {
      return new NodalFactor(
          1.009 + 0.187 * cos(n) - 0.015 * cos(2 * n),
          10.8 * sin(n) - 1.3 * sin(2 * n) + 0.2 * sin(3 * n));
    }
  },
  K1 {
    @Override
    NodalFactor evaluate(double n) {
      return new NodalFactor(
          1.006 + 0.115 * cos(n) - 0.009 * cos(2 * n),
          -8.9 * sin(n) + 0.7 * sin(2 * n));
    }
  },
  M2 {
    @Override
    NodalFactor evaluate(double n) {
      return new NodalFactor(1.0 - 0.037 * cos(n), -2.1 * sin(n));
    }
  },
  K2 {
    @Override
    NodalFactor evaluate(double n) {
      return new NodalFactor(
          1.024 + 0.286 * cos(n) + 0.008 * cos(2 * n),
          -17.7 * sin(n) + 0.7 * sin(2 * n));
    }
  },
  M2_SQUARED {
    @Override
    NodalFactor evaluate(double n) {
      NodalFactor m2 = M2.evaluate(n);
      return new NodalFactor(m2.f() * m2.f(), 2 * m2.uDegrees());
    }
  },
  M2_CUBED {
    @Override
    NodalFactor evaluate(double n) {
      NodalFactor m2 = M2.evaluate(n);
      return new NodalFactor(m2.f() * m2.f() * m2.f(), 3 * m2.uDegrees());
    }
  };

  /**
   * Computes the amplitude factor and phase correction.
   *
   * @param n lunar node longitude in degrees
   * @return nodal factor
   */
  abstract NodalFactor evaluate(double n);

  private static double cos(double degrees) {
    return Math.cos(Math.toRadians(degrees));
  }

  private static double sin(double degrees) {
    return Math.sin(Math.toRadians(degrees));
  }

  /**
   * Amplitude factor f and phase correction u.
   *
   * @param f amplitude multiplier
   * @param uDegrees phase correction in degrees
   */
  record NodalFactor(double f, double uDegrees) {
    static final NodalFactor UNITY = new NodalFactor(1.0, 0.0);
  }
}
