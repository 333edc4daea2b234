package io.lazytable.runtime;

import io.lazytable.kernel.ColumnComputer;
import io.lazytable.kernel.ColumnSpec;
import io.lazytable.kernel.ComputeResult;
import io.lazytable.kernel.selection.RowSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Routes each column to the computer registered for its computation kind.
 * <p>
 * A column whose kind has no registered computer fails with a result value, so a
 * misconfigured column only affects the pages that contain it.
 */
public final class ComputerRegistry implements ColumnComputer {

    private static final Logger LOG = LoggerFactory.getLogger(ComputerRegistry.class);

    private final ConcurrentMap<String, ColumnComputer> computers = new ConcurrentHashMap<>();

    /**
     * Register the computer for a computation kind.
     *
     * @param computationKind kind name as used in {@link ColumnSpec#computationKind()}
     * @param computer        the computer
     * @return this registry for method chaining
     * @throws IllegalArgumentException if the kind is already registered
     */
    public ComputerRegistry register(String computationKind, ColumnComputer computer) {
        Objects.requireNonNull(computationKind, "computationKind");
        Objects.requireNonNull(computer, "computer");
        ColumnComputer previous = computers.putIfAbsent(computationKind, computer);
        if (previous != null) {
            throw new IllegalArgumentException("Computation kind already registered: " + computationKind);
        }
        LOG.debug("Registered computer for '{}'", computationKind);
        return this;
    }

    public boolean supports(String computationKind) {
        return computers.containsKey(computationKind);
    }

    public Set<String> computationKinds() {
        return Collections.unmodifiableSet(computers.keySet());
    }

    @Override
    public ComputeResult compute(RowSelector window, ColumnSpec spec) {
        ColumnComputer computer = computers.get(spec.computationKind());
        if (computer == null) {
            return ComputeResult.failure("no computer registered for computation kind '" + spec.computationKind() + "'");
        }
        return computer.compute(window, spec);
    }
}
