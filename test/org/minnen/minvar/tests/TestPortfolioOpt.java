package org.minnen.minvar.tests;

import static org.junit.Assert.*;

import org.junit.Test;
import org.minnen.minvar.config.Constraints;
import org.minnen.minvar.cov.CovarianceMethod;
import org.minnen.minvar.opt.OptimizationResult;
import org.minnen.minvar.opt.OptimizationResult.Status;
import org.minnen.minvar.opt.PortfolioOpt;
import org.minnen.minvar.util.Library;

public class TestPortfolioOpt
{
  private static void assertValid(double[] w, double lower, double upper)
  {
    assertEquals(1.0, Library.sum(w), 1e-6);
    for (double x : w) {
      assertTrue(x >= lower - 1e-6);
      assertTrue(x <= upper + 1e-6);
    }
  }

  @Test
  public void testDiagonalLongOnly()
  {
    double[][] cov = new double[][] { { 1, 0 }, { 0, 4 } };
    OptimizationResult result = PortfolioOpt.minvar(cov, Constraints.longOnly(1.0));
    assertEquals(Status.OPTIMAL, result.status);
    assertArrayEquals(new double[] { 0.8, 0.2 }, result.weights, 1e-4);
    assertValid(result.weights, 0.0, 1.0);
  }

  @Test
  public void testUpperBoundBinds()
  {
    double[][] cov = new double[][] { { 1, 0, 0 }, { 0, 4, 0 }, { 0, 0, 9 } };

    OptimizationResult result = PortfolioOpt.minvar(cov, Constraints.longOnly(1.0));
    assertTrue(result.isOptimal());
    assertArrayEquals(new double[] { 36.0 / 49, 9.0 / 49, 4.0 / 49 }, result.weights, 1e-4);

    result = PortfolioOpt.minvar(cov, Constraints.longOnly(0.5));
    assertTrue(result.isOptimal());
    assertArrayEquals(new double[] { 0.5, 4.5 / 13, 2.0 / 13 }, result.weights, 1e-3);
    assertValid(result.weights, 0.0, 0.5);
  }

  @Test
  public void testShortPosition()
  {
    // Strong correlation makes the low-variance asset worth levering against the other.
    double[][] cov = new double[][] { { 1, 1.8 }, { 1.8, 4 } };

    OptimizationResult result = PortfolioOpt.minvar(cov, Constraints.longShort(-2.0, 2.0));
    assertTrue(result.isOptimal());
    assertArrayEquals(new double[] { 2.2 / 1.4, -0.8 / 1.4 }, result.weights, 1e-4);

    result = PortfolioOpt.minvar(cov, Constraints.longShort(-1.0, 1.0));
    assertTrue(result.isOptimal());
    assertArrayEquals(new double[] { 1.0, 0.0 }, result.weights, 1e-4);
    assertValid(result.weights, -1.0, 1.0);

    result = PortfolioOpt.minvar(cov, Constraints.longOnly(1.0));
    assertTrue(result.isOptimal());
    assertArrayEquals(new double[] { 1.0, 0.0 }, result.weights, 1e-4);
  }

  @Test
  public void testNoShortingClampsLowerBound()
  {
    double[][] cov = new double[][] { { 1, 1.8 }, { 1.8, 4 } };
    Constraints constraints = new Constraints(-2.0, 2.0, false, false);
    assertEquals(0.0, constraints.getLower(), 0.0);
    OptimizationResult result = PortfolioOpt.minvar(cov, constraints);
    assertValid(result.weights, 0.0, 2.0);
  }

  @Test
  public void testExpectedReturns()
  {
    double[][] cov = new double[][] { { 1, 0 }, { 0, 1 } };
    double[] mu = new double[] { 0.0, 1.0 };

    // min w'w - 0.5 * w2 -> w = (0.375, 0.625)
    OptimizationResult result = PortfolioOpt.minvar(cov, mu, 0.5, Constraints.longOnly(1.0));
    assertTrue(result.isOptimal());
    assertArrayEquals(new double[] { 0.375, 0.625 }, result.weights, 1e-4);

    result = PortfolioOpt.minvar(cov, mu, 0.0, Constraints.longOnly(1.0));
    assertArrayEquals(new double[] { 0.5, 0.5 }, result.weights, 1e-4);
  }

  @Test
  public void testInfeasible()
  {
    double[][] cov = new double[][] { { 1, 0, 0 }, { 0, 2, 0 }, { 0, 0, 3 } };
    OptimizationResult result = PortfolioOpt.minvar(cov, Constraints.longOnly(0.2));
    assertEquals(Status.INFEASIBLE, result.status);
    assertFalse(result.isOptimal());
    assertArrayEquals(Library.equalWeights(3), result.weights, 1e-12);
    assertNotNull(result.message);

    result = PortfolioOpt.minvar(cov, 0.4, 1.0);
    assertEquals(Status.INFEASIBLE, result.status);
  }

  @Test
  public void testTightBox()
  {
    double[][] cov = new double[][] { { 1, 0 }, { 0, 4 } };
    OptimizationResult result = PortfolioOpt.minvar(cov, new Constraints(0.5, 0.5, false, true));
    assertEquals(Status.OPTIMAL, result.status);
    assertArrayEquals(new double[] { 0.5, 0.5 }, result.weights, 0.0);

    result = PortfolioOpt.minvar(new double[][] { { 2.0 } }, Constraints.longOnly(1.0));
    assertEquals(Status.OPTIMAL, result.status);
    assertArrayEquals(new double[] { 1.0 }, result.weights, 0.0);
  }

  @Test
  public void testShrunkCovariance()
  {
    double[][] x = AllTests.randomReturns(10, 15, 31);
    double[][] cov = CovarianceMethod.SHRINKAGE.estimate(x).matrix;

    OptimizationResult result = PortfolioOpt.minvar(cov, Constraints.longOnly(1.0));
    assertTrue(result.isOptimal());
    assertValid(result.weights, 0.0, 1.0);

    result = PortfolioOpt.minvar(cov, Constraints.longShort(-1.0, 1.0));
    assertTrue(result.isOptimal());
    assertValid(result.weights, -1.0, 1.0);

    // Optimized portfolio is never riskier than equal weights.
    double[] ew = Library.equalWeights(15);
    assertTrue(Library.quadForm(cov, result.weights) <= Library.quadForm(cov, ew) + 1e-12);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testAsymmetric()
  {
    PortfolioOpt.minvar(new double[][] { { 1, 0.5 }, { 0.2, 1 } }, Constraints.longOnly(1.0));
  }
}
