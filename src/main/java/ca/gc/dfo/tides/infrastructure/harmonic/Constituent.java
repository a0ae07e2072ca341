package ca.gc.dfo.tides.infrastructure.harmonic;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Catalogue of tidal constituents the least-squares solver can fit.
 *
 * <p>Each entry carries its conventional code, angular speed in degrees per mean solar hour, the Doodson
 * multipliers of (&tau;, s, h, p, N', p<sub>1</sub>), the phase offset in degrees added to the equilibrium argument,
 * and the nodal correction group.
 *
 * @since 0.1.0
 */
enum Constituent {
  M2("M2", 28.9841042, new int[] {2, 0, 0, 0, 0, 0}, 0, NodalGroup.M2),
  S2("S2", 30.0000000, new int[] {2, 2, -2, 0, 0, 0}, 0, NodalGroup.NONE),
  N2("N2", 28.4397295, new int[] {2, -1, 0, 1, 0, 0}, 0, NodalGroup.M2),
  K2("K2", 30.0821373, new int[] {2, 2, 0, 0, 0, 0}, 0, NodalGroup.K2),
  K1("K1", 15.0410686, new int[] {1, 1, 0, 0, 0, 0}, 90, NodalGroup.K1),
  O1("O1", 13.9430356, new int[] {1, -1, 0, 0, 0, 0}, -90, NodalGroup.O1),
  P1("P1", 14.9589314, new int[] {1, 1, -2, 0, 0, 0}, -90, NodalGroup.NONE),
  Q1("Q1", 13.3986609, new int[] {1, -2, 0, 1, 0, 0}, -90, NodalGroup.O1),
  TWO_N2("2N2", 27.8953548, new int[] {2, -2, 0, 2, 0, 0}, 0, NodalGroup.M2),
  MU2("MU2", 27.9682084, new int[] {2, -2, 2, 0, 0, 0}, 0, NodalGroup.M2),
  NU2("NU2", 28.5125831, new int[] {2, -1, 2, -1, 0, 0}, 0, NodalGroup.M2),
  T2("T2", 29.9589333, new int[] {2, 2, -3, 0, 0, 1}, 0, NodalGroup.NONE),
  M4("M4", 57.9682084, new int[] {4, 0, 0, 0, 0, 0}, 0, NodalGroup.M2_SQUARED),
  MS4("MS4", 58.9841042, new int[] {4, 2, -2, 0, 0, 0}, 0, NodalGroup.M2),
  MN4("MN4", 57.4238337, new int[] {4, -1, 0, 1, 0, 0}, 0, NodalGroup.M2_SQUARED),
  S4("S4", 60.0000000, new int[] {4, 4, -4, 0, 0, 0}, 0, NodalGroup.NONE),
  M6("M6", 86.9523127, new int[] {6, 0, 0, 0, 0, 0}, 0, NodalGroup.M2_CUBED),
  MF("Mf", 1.0980331, new int[] {0, 2, 0, 0, 0, 0}, 0, NodalGroup.MF),
  MM("Mm", 0.5443747, new int[] {0, 1, 0, -1, 0, 0}, 0, NodalGroup.MM),
  SSA("Ssa", 0.0821373, new int[] {0, 0, 2, 0, 0, 0}, 0, NodalGroup.NONE),
  SA("Sa", 0.0410686, new int[] {0, 0, 1, 0, 0, 0}, 0, NodalGroup.NONE);

  private static final Map<String, Constituent> BY_CODE = new HashMap<>();

  static {
    for (Constituent constituent : values()) {
      BY_CODE.put(constituent.code.toUpperCase(Locale.ROOT), constituent);
    }
  }

  private final String code;
  private final double degreesPerHour;
  private final int[] doodson;
  private final double phaseOffsetDegrees;
  private final NodalGroup nodalGroup;

  Constituent(String code, double degreesPerHour, int[] doodson, double phaseOffsetDegrees, NodalGroup nodalGroup) {
    this.code = code;
    this.degreesPerHour = degreesPerHour;
    this.doodson = doodson;
    this.phaseOffsetDegrees = phaseOffsetDegrees;
    this.nodalGroup = nodalGroup;
  }

  /**
   * Looks up a constituent by code, ignoring case.
   *
   * @param code code such as {@code "M2"} or {@code "mf"}
   * @return matching constituent, or empty when unknown
   */
  static Optional<Constituent> lookup(String code) {
    if (code == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_CODE.get(code.trim().toUpperCase(Locale.ROOT)));
  }

  String code() {
    return code;
  }

  double degreesPerHour() {
    return degreesPerHour;
  }

  /** Angular speed in radians per second. */
  double radiansPerSecond() {
    return Math.toRadians(degreesPerHour) / 3600.0;
  }

  NodalGroup nodalGroup() {
    return nodalGroup;
  }

  /**
   * Computes the equilibrium argument V0 in degrees for the given astronomical state.
   *
   * @param args mean longitudes at the reference epoch
   * @return V0 in degrees, not normalized
   */
  double equilibriumArgumentDegrees(AstronomicalArguments args) {
    return doodson[0] * args.tau()
        + doodson[1] * args.s()
        + doodson[2] * args.h()
        + doodson[3] * args.p()
        + doodson[4] * args.nPrime()
        + doodson[5] * args.p1()
        + phaseOffsetDegrees;
  }
}
