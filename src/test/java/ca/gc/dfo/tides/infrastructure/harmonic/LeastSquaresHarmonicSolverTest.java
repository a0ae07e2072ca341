package ca.gc.dfo.tides.infrastructure.harmonic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.dfo.tides.application.analysis.HarmonicAnalyzer;
import ca.gc.dfo.tides.application.port.HarmonicSolution;
import ca.gc.dfo.tides.domain.error.HarmonicAnalysisException;
import ca.gc.dfo.tides.domain.series.Sample;
import ca.gc.dfo.tides.domain.series.TimeSeries;
import ca.gc.dfo.tides.domain.tide.HarmonicResult;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class LeastSquaresHarmonicSolverTest {
  private static final LocalDateTime T0 = LocalDateTime.of(2021, 3, 1, 0, 0);
  private static final ZonedDateTime EPOCH = T0.atZone(ZoneOffset.UTC);
  private static final int HOURS = 30 * 24;

  @Test
  void plainModeRecoversAmplitudesAndPhases() {
    TimeSeries series = signal(Constituent.M2, 1.2, 30.0, Constituent.S2, 0.4, 100.0, 2.5);

    HarmonicResult result = new HarmonicAnalyzer(new LeastSquaresHarmonicSolver(false))
        .analyzeConstituents(series, List.of("M2", "S2"), EPOCH);

    assertEquals(1.2, result.estimate("M2").orElseThrow().amplitude(), 1e-6);
    assertEquals(30.0, result.estimate("M2").orElseThrow().phaseDegrees(), 1e-4);
    assertEquals(0.4, result.estimate("S2").orElseThrow().amplitude(), 1e-6);
    assertEquals(100.0, result.estimate("S2").orElseThrow().phaseDegrees(), 1e-4);
    assertEquals(2.5, result.meanLevel(), 1e-6);
  }

  @Test
  void astronomicalModeReferencesPhaseToEquilibriumArgument() {
    AstronomicalArguments args = AstronomicalArguments.at(EPOCH);
    NodalGroup.NodalFactor nodal = Constituent.M2.nodalGroup().evaluate(args.n());
    double offset = Constituent.M2.equilibriumArgumentDegrees(args) + nodal.uDegrees();
    double g = 75.0;
    double amplitude = 0.9;
    TimeSeries series = signal(Constituent.M2, amplitude * nodal.f(), g - offset, null, 0, 0, 0.0);

    HarmonicResult result = new HarmonicAnalyzer(new LeastSquaresHarmonicSolver(true))
        .analyzeConstituents(series, List.of("M2"), EPOCH);

    assertEquals(amplitude, result.estimate("M2").orElseThrow().amplitude(), 1e-6);
    assertEquals(0.0, angleDifference(g, result.estimate("M2").orElseThrow().phaseDegrees()), 1e-4);
  }

  @Test
  void constituentCodesAreCaseInsensitive() {
    assertTrue(LeastSquaresHarmonicSolver.isKnown("m2"));
    assertTrue(LeastSquaresHarmonicSolver.isKnown("2N2"));
    assertTrue(LeastSquaresHarmonicSolver.isKnown("MF"));
    assertFalse(LeastSquaresHarmonicSolver.isKnown("ZZ9"));
    assertTrue(LeastSquaresHarmonicSolver.knownConstituents().contains("K1"));
  }

  @Test
  void unknownConstituentFails() {
    LeastSquaresHarmonicSolver solver = new LeastSquaresHarmonicSolver();

    assertThrows(HarmonicAnalysisException.class, () -> solver.configure(List.of("M2", "XX"), EPOCH));
  }

  @Test
  void tooFewSamplesFails() {
    LeastSquaresHarmonicSolver solver = new LeastSquaresHarmonicSolver(false);

    assertThrows(HarmonicAnalysisException.class, () -> solver.configure(List.of("M2", "S2"), EPOCH)
        .analyze(new double[] {0, 3600, 7200, 10800}, new double[] {1, 2, 3, 4}));
  }

  @Test
  void mismatchedArraysFail() {
    LeastSquaresHarmonicSolver solver = new LeastSquaresHarmonicSolver(false);

    assertThrows(HarmonicAnalysisException.class,
        () -> solver.configure(List.of("M2"), EPOCH).analyze(new double[] {0, 1, 2}, new double[] {1, 2}));
  }

  @Test
  void inseparableConstituentsAreReportedAsSingular() {
    LeastSquaresHarmonicSolver solver = new LeastSquaresHarmonicSolver(false);
    double[] elapsed = {0, 0, 0, 0, 0, 0, 0};
    double[] values = {1, 1, 1, 1, 1, 1, 1};

    assertThrows(HarmonicAnalysisException.class,
        () -> solver.configure(List.of("M2", "S2"), EPOCH).analyze(elapsed, values));
  }

  @Test
  void solutionKeepsConfiguredOrder() {
    LeastSquaresHarmonicSolver solver = new LeastSquaresHarmonicSolver(false);
    TimeSeries series = signal(Constituent.M2, 1.0, 0.0, Constituent.K1, 0.5, 0.0, 0.0);
    double[] elapsed = new double[series.size()];
    double[] values = new double[series.size()];
    for (int i = 0; i < series.size(); i++) {
      elapsed[i] = i * 3600.0;
      values[i] = series.samples().get(i).value();
    }

    HarmonicSolution solution = solver.configure(List.of("K1", "M2"), EPOCH).analyze(elapsed, values);

    assertEquals(0.5, solution.amplitudes()[0], 1e-6);
    assertEquals(1.0, solution.amplitudes()[1], 1e-6);
  }

  private static TimeSeries signal(
      Constituent first, double a1, double phase1Degrees,
      Constituent second, double a2, double phase2Degrees,
      double mean) {
    List<Sample> samples = new ArrayList<>(HOURS);
    for (int i = 0; i < HOURS; i++) {
      double t = i * 3600.0;
      double value = mean + a1 * Math.cos(first.radiansPerSecond() * t - Math.toRadians(phase1Degrees));
      if (second != null) {
        value += a2 * Math.cos(second.radiansPerSecond() * t - Math.toRadians(phase2Degrees));
      }
      samples.add(Sample.of(T0.plusHours(i), value));
    }
    return TimeSeries.seaLevel(samples);
  }

  private static double angleDifference(double expected, double actual) {
    double diff = (actual - expected) % 360.0;
    if (diff > 180.0) {
      diff -= 360.0;
    } else if (diff <= -180.0) {
      diff += 360.0;
    }
    return diff;
  }
}
