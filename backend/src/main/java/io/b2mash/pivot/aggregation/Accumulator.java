package io.b2mash.pivot.aggregation;

import io.b2mash.pivot.model.DataValues;
import java.util.HashSet;
import java.util.Set;

/**
 * Running state of one aggregation. The state is richer than the displayed value (sum and count
 * for averages, the value set for distinct counts) so that rows can be added later and still
 * produce the exact result of a full recomputation.
 */
public interface Accumulator {

  /** Feeds the field value of one contributing row; the value may be null. */
  void add(Object value);

  /** The aggregated value for the rows seen so far. */
  Number result();

  /** An independent copy that can be advanced without touching this instance. */
  Accumulator copy();

  final class Sum implements Accumulator {
    private double sum;

    @Override
    public void add(Object value) {
      Double number = DataValues.asFiniteNumber(value);
      if (number != null) {
        sum += number;
      }
    }

    @Override
    public Number result() {
      return sum;
    }

    @Override
    public Accumulator copy() {
      var copy = new Sum();
      copy.sum = sum;
      return copy;
    }
  }

  final class Average implements Accumulator {
    private double sum;
    private long count;

    @Override
    public void add(Object value) {
      Double number = DataValues.asFiniteNumber(value);
      if (number != null) {
        sum += number;
        count++;
      }
    }

    @Override
    public Number result() {
      return count == 0 ? 0.0 : sum / count;
    }

    @Override
    public Accumulator copy() {
      var copy = new Average();
      copy.sum = sum;
      copy.count = count;
      return copy;
    }
  }

  final class Extreme implements Accumulator {
    private final boolean maximum;
    private boolean seen;
    private double current;

    Extreme(boolean maximum) {
      this.maximum = maximum;
    }

    @Override
    public void add(Object value) {
      Double number = DataValues.asFiniteNumber(value);
      if (number == null) {
        return;
      }
      if (!seen) {
        current = number;
        seen = true;
      } else {
        current = maximum ? Math.max(current, number) : Math.min(current, number);
      }
    }

    @Override
    public Number result() {
      return seen ? current : 0.0;
    }

    @Override
    public Accumulator copy() {
      var copy = new Extreme(maximum);
      copy.seen = seen;
      copy.current = current;
      return copy;
    }
  }

  /** Counts rows, whatever their value. */
  final class Count implements Accumulator {
    private long count;

    @Override
    public void add(Object value) {
      count++;
    }

    @Override
    public Number result() {
      return count;
    }

    @Override
    public Accumulator copy() {
      var copy = new Count();
      copy.count = count;
      return copy;
    }
  }

  final class CountDistinct implements Accumulator {
    private final Set<String> distinct = new HashSet<>();

    @Override
    public void add(Object value) {
      if (value != null) {
        distinct.add(DataValues.stringify(value));
      }
    }

    @Override
    public Number result() {
      return (long) distinct.size();
    }

    @Override
    public Accumulator copy() {
      var copy = new CountDistinct();
      copy.distinct.addAll(distinct);
      return copy;
    }
  }
}
