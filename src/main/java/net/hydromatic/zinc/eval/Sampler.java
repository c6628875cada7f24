/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.zinc.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.base.Suppliers;
import java.util.List;
import java.util.function.Supplier;
import net.hydromatic.zinc.ast.Pos;
import org.apache.commons.math3.distribution.BinomialDistribution;
import org.apache.commons.math3.distribution.CauchyDistribution;
import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.distribution.EnumeratedIntegerDistribution;
import org.apache.commons.math3.distribution.ExponentialDistribution;
import org.apache.commons.math3.distribution.FDistribution;
import org.apache.commons.math3.distribution.GammaDistribution;
import org.apache.commons.math3.distribution.LogNormalDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.PoissonDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.distribution.UniformRealDistribution;
import org.apache.commons.math3.distribution.WeibullDistribution;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomDataGenerator;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Draws samples from probability distributions.
 *
 * <p>Each method checks its parameters, and throws {@link EvalException} if
 * they are outside the distribution's domain, before drawing from the
 * engine. A degenerate distribution (zero spread, or an empty interval)
 * returns its single value without drawing.
 *
 * <p>Not thread-safe.
 */
public class Sampler {
  private static final Supplier<Sampler> INSTANCE =
      Suppliers.memoize(() -> new Sampler(new MersenneTwister()));

  private final RandomGenerator random;

  public Sampler(RandomGenerator random) {
    this.random = requireNonNull(random);
  }

  /** Returns the process-wide sampler, creating it on first use. */
  public static Sampler instance() {
    return INSTANCE.get();
  }

  public double normal(double mean, double stdDev, Pos pos) {
    if (stdDev < 0d) {
      throw new EvalException("standard deviation of normal distribution "
          + "cannot be negative: " + stdDev, pos);
    }
    if (stdDev == 0d) {
      return mean;
    }
    return new NormalDistribution(random, mean, stdDev,
        NormalDistribution.DEFAULT_INVERSE_ABSOLUTE_ACCURACY).sample();
  }

  /** Returns an integer uniformly distributed in {@code lower..upper}. */
  public IntVal uniform(IntVal lower, IntVal upper, Pos pos) {
    final int c = lower.compareTo(upper);
    if (c > 0) {
      throw new EvalException("lowerbound of uniform distribution \""
          + lower + "\" is higher than its upperbound: " + upper, pos);
    }
    if (c == 0) {
      return lower;
    }
    return IntVal.of(
        new RandomDataGenerator(random)
            .nextLong(lower.toLong(), upper.toLong()));
  }

  /** Returns a float uniformly distributed in {@code [lower, upper)}. */
  public double uniform(double lower, double upper, Pos pos) {
    if (lower > upper) {
      throw new EvalException("lowerbound of uniform distribution \""
          + Formatter.showFloat(lower) + "\" is higher than its upperbound: "
          + Formatter.showFloat(upper), pos);
    }
    if (lower == upper) {
      return lower;
    }
    return new UniformRealDistribution(random, lower, upper).sample();
  }

  public IntVal poisson(double mean, Pos pos) {
    if (mean < 0d) {
      throw new EvalException("mean of poisson distribution cannot be "
          + "negative: " + mean, pos);
    }
    if (mean == 0d) {
      return IntVal.of(0);
    }
    return IntVal.of(
        new PoissonDistribution(random, mean,
            PoissonDistribution.DEFAULT_EPSILON,
            PoissonDistribution.DEFAULT_MAX_ITERATIONS).sample());
  }

  public double gamma(double shape, double scale, Pos pos) {
    if (shape <= 0d || scale <= 0d) {
      throw new EvalException("parameters of gamma distribution must be "
          + "positive: " + shape + ", " + scale, pos);
    }
    return new GammaDistribution(random, shape, scale).sample();
  }

  public double weibull(double shape, double scale, Pos pos) {
    if (shape <= 0d) {
      throw new EvalException("shape parameter of weibull distribution "
          + "must be positive: " + shape, pos);
    }
    if (scale <= 0d) {
      throw new EvalException("scale parameter of weibull distribution "
          + "must be positive: " + scale, pos);
    }
    return new WeibullDistribution(random, shape, scale).sample();
  }

  /** Samples an exponential distribution with rate {@code lambda}. */
  public double exponential(double lambda, Pos pos) {
    if (lambda <= 0d) {
      throw new EvalException("lambda parameter of exponential distribution "
          + "must be positive: " + lambda, pos);
    }
    return new ExponentialDistribution(random, 1d / lambda).sample();
  }

  /** Samples a distribution whose logarithm is normally distributed with
   * the given mean and standard deviation. */
  public double lognormal(double mean, double stdDev, Pos pos) {
    if (stdDev < 0d) {
      throw new EvalException("standard deviation of lognormal "
          + "distribution cannot be negative: " + stdDev, pos);
    }
    if (stdDev == 0d) {
      return Math.exp(mean);
    }
    return new LogNormalDistribution(random, mean, stdDev).sample();
  }

  /** Samples a chi-squared distribution with {@code k} degrees of
   * freedom. */
  public double chiSquared(double k, Pos pos) {
    if (k <= 0d) {
      throw new EvalException("degrees of freedom of chi-squared "
          + "distribution must be positive: " + k, pos);
    }
    return new ChiSquaredDistribution(random, k).sample();
  }

  public double cauchy(double location, double scale, Pos pos) {
    if (scale <= 0d) {
      throw new EvalException("scale parameter of cauchy distribution must "
          + "be positive: " + scale, pos);
    }
    return new CauchyDistribution(random, location, scale).sample();
  }

  /** Samples Fisher's F-distribution. */
  public double fDistribution(double m, double n, Pos pos) {
    if (m <= 0d || n <= 0d) {
      throw new EvalException("degrees of freedom of f-distribution must be "
          + "positive: " + m + ", " + n, pos);
    }
    return new FDistribution(random, m, n).sample();
  }

  /** Samples Student's t-distribution. */
  public double tDistribution(double n, Pos pos) {
    if (n <= 0d) {
      throw new EvalException("degrees of freedom of t-distribution must be "
          + "positive: " + n, pos);
    }
    return new TDistribution(random, n).sample();
  }

  /** Returns an index in {@code 1..weights.size()}, chosen with probability
   * proportional to its weight. */
  public IntVal discrete(List<IntVal> weights, Pos pos) {
    final int[] indexes = new int[weights.size()];
    final double[] probabilities = new double[weights.size()];
    long total = 0;
    for (int i = 0; i < weights.size(); i++) {
      final IntVal w = weights.get(i);
      if (w.signum() < 0) {
        throw new EvalException("weights of discrete distribution cannot be "
            + "negative: " + w, pos);
      }
      total = Math.addExact(total, w.toLong());
      indexes[i] = i + 1;
      probabilities[i] = w.toDouble();
    }
    if (total == 0) {
      throw new EvalException("weights of discrete distribution must have a "
          + "positive sum", pos);
    }
    return IntVal.of(
        new EnumeratedIntegerDistribution(random, indexes, probabilities)
            .sample());
  }

  public boolean bernoulli(double p, Pos pos) {
    checkProbability("bernoulli", p, pos);
    return new BinomialDistribution(random, 1, p).sample() == 1;
  }

  /** Returns the number of successes in {@code n} trials, each with
   * probability {@code p}.
   *
   * @throws EvalException if {@code n} is negative or greater than
   * {@link Integer#MAX_VALUE} */
  public IntVal binomial(IntVal n, double p, Pos pos) {
    checkProbability("binomial", p, pos);
    if (n.signum() < 0) {
      throw new EvalException("number of trials of binomial distribution "
          + "cannot be negative: " + n, pos);
    }
    if (n.compareTo(IntVal.of(Integer.MAX_VALUE)) > 0) {
      throw new EvalException("number of trials of binomial distribution "
          + "is too large: " + n, pos);
    }
    return IntVal.of(
        new BinomialDistribution(random, (int) n.toLong(), p).sample());
  }

  private static void checkProbability(String distribution, double p,
      Pos pos) {
    if (!(p >= 0d && p <= 1d)) {
      throw new EvalException("probability of " + distribution
          + " distribution must be between 0 and 1: " + p, pos);
    }
  }
}

// End Sampler.java
