package io.lacuna.epsilon;

import io.lacuna.bifurcan.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Builds an {@link Automaton} from an explicit transition table.  Rows which share a source state and symbol are
 * merged, so their destinations accumulate rather than shadow each other.
 *
 * @param <Q> the states of the automaton
 * @param <S> the symbols that trigger transitions between states
 */
public class AutomatonBuilder<Q, S> {

  private static final Logger LOG = LoggerFactory.getLogger(AutomatonBuilder.class);

  private static class Row<Q, S> {
    final Q state;
    final Optional<S> symbol;
    final ISet<Q> destinations;

    Row(Q state, Optional<S> symbol, ISet<Q> destinations) {
      this.state = state;
      this.symbol = symbol;
      this.destinations = destinations;
    }
  }

  private final LinearSet<Q> states = new LinearSet<>();
  private final LinearSet<S> alphabet = new LinearSet<>();
  private final LinearSet<Q> accept = new LinearSet<>();
  private final LinearList<Row<Q, S>> table = new LinearList<>();
  private Q start;

  public AutomatonBuilder() {
  }

  /**
   * @return the current builder, with {@code states} declared
   */
  @SafeVarargs
  public final AutomatonBuilder<Q, S> states(Q... states) {
    for (Q q : states) {
      this.states.add(Objects.requireNonNull(q));
    }
    return this;
  }

  /**
   * @return the current builder, with {@code symbols} added to the alphabet
   */
  @SafeVarargs
  public final AutomatonBuilder<Q, S> alphabet(S... symbols) {
    for (S s : symbols) {
      alphabet.add(Objects.requireNonNull(s));
    }
    return this;
  }

  /**
   * @return the current builder, with edges labeled {@code symbol} from {@code state} to each of {@code destinations}
   */
  @SafeVarargs
  public final AutomatonBuilder<Q, S> transition(Q state, S symbol, Q... destinations) {
    return row(state, Optional.of(Objects.requireNonNull(symbol)), destinations);
  }

  /**
   * @return the current builder, with epsilon edges from {@code state} to each of {@code destinations}
   */
  @SafeVarargs
  public final AutomatonBuilder<Q, S> epsilon(Q state, Q... destinations) {
    return row(state, Optional.empty(), destinations);
  }

  /**
   * @return the current builder, with a table row where an empty {@code symbol} denotes epsilon
   */
  public AutomatonBuilder<Q, S> row(Q state, Optional<S> symbol, Iterable<Q> destinations) {
    LinearSet<Q> dsts = new LinearSet<>();
    destinations.forEach(q -> dsts.add(Objects.requireNonNull(q)));
    table.addLast(new Row<>(Objects.requireNonNull(state), Objects.requireNonNull(symbol), dsts));
    return this;
  }

  @SafeVarargs
  private final AutomatonBuilder<Q, S> row(Q state, Optional<S> symbol, Q... destinations) {
    return row(state, symbol, LinearList.of(destinations));
  }

  public AutomatonBuilder<Q, S> start(Q state) {
    this.start = Objects.requireNonNull(state);
    return this;
  }

  @SafeVarargs
  public final AutomatonBuilder<Q, S> accept(Q... states) {
    for (Q q : states) {
      accept.add(Objects.requireNonNull(q));
    }
    return this;
  }

  ///

  /**
   * @return an automaton over the table
   * @throws MalformedTransitionTableException if any row references an undeclared state or symbol
   * @throws InvalidStartStateException if the start state is undeclared
   * @throws InvalidFinalStatesException if any accepting state is undeclared
   * @throws IllegalStateException if no start state was given
   */
  public Automaton<Q, S> build() {
    if (start == null) {
      throw new IllegalStateException("no start state");
    }

    LinearMap<Q, IMap<Optional<S>, ISet<Q>>> relation = new LinearMap<>();

    for (Row<Q, S> row : table) {
      validate(row);

      IMap<Optional<S>, ISet<Q>> edges = relation.getOrCreate(row.state, LinearMap::new);
      Optional<ISet<Q>> prev = edges.get(row.symbol);
      if (prev.isPresent()) {
        LOG.debug("merging duplicate transition ({}, {})", row.state, row.symbol);
        edges.put(row.symbol, prev.get().union(row.destinations));
      } else {
        edges.put(row.symbol, row.destinations);
      }
    }

    LOG.debug("built transition table with {} rows over {} states", table.size(), relation.size());

    return Automaton.create(
            states,
            alphabet,
            (q, s) -> relation.get(q)
                    .flatMap(edges -> edges.get(s))
                    .orElseGet(LinearSet::new),
            start,
            accept);
  }

  private void validate(Row<Q, S> row) {
    if (!states.contains(row.state)) {
      throw new MalformedTransitionTableException(row.state, row.symbol, "undeclared source state " + row.state);
    }

    if (row.symbol.isPresent() && !alphabet.contains(row.symbol.get())) {
      throw new MalformedTransitionTableException(row.state, row.symbol, "undeclared symbol " + row.symbol.get());
    }

    for (Q q : row.destinations) {
      if (!states.contains(q)) {
        throw new MalformedTransitionTableException(row.state, row.symbol, "undeclared destination state " + q);
      }
    }
  }
}
