package de.bsommerfeld.landcover.core.graph;

import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Lazily evaluated node of a raster transformation graph.
 *
 * <p>
 * A node is an immutable descriptor: the ordered names of the steps that
 * produce it (its lineage) and the computation itself. Composing nodes via
 * {@link #map} and {@link #combine} only builds a larger descriptor; no pixel
 * is touched and no backend is called until {@link #resolve()}. Resolution is
 * memoized and thread-safe, so a node shared by several downstream branches
 * is evaluated once.
 *
 * @param <T> type of the value the node resolves to
 */
public final class Deferred<T> {

    private final ImmutableList<String> lineage;
    private final Supplier<T> computation;

    private Deferred(ImmutableList<String> lineage, Supplier<T> computation) {
        this.lineage = lineage;
        this.computation = Suppliers.memoize(computation::get);
    }

    /** A source node whose value is computed by {@code supplier} on first resolve. */
    public static <T> Deferred<T> of(String step, Supplier<T> supplier) {
        Objects.requireNonNull(supplier, "supplier");
        return new Deferred<>(ImmutableList.of(step), supplier);
    }

    /** A source node wrapping an already materialized value. */
    public static <T> Deferred<T> completed(String step, T value) {
        Objects.requireNonNull(value, "value");
        return new Deferred<>(ImmutableList.of(step), () -> value);
    }

    public <R> Deferred<R> map(String step, Function<? super T, ? extends R> fn) {
        Objects.requireNonNull(fn, "fn");
        ImmutableList<String> next = ImmutableList.<String>builder().addAll(lineage).add(step).build();
        return new Deferred<>(next, () -> fn.apply(resolve()));
    }

    /**
     * Joins two nodes. The lineage lists the left branch, then the right
     * branch, then {@code step}.
     */
    public static <A, B, R> Deferred<R> combine(String step, Deferred<A> left, Deferred<B> right,
            BiFunction<? super A, ? super B, ? extends R> fn) {
        Objects.requireNonNull(fn, "fn");
        ImmutableList<String> joined = ImmutableList.<String>builder()
                .addAll(left.lineage).addAll(right.lineage).add(step).build();
        return new Deferred<>(joined, () -> fn.apply(left.resolve(), right.resolve()));
    }

    /**
     * Evaluates the node, and transitively everything it depends on. Failures
     * propagate unchanged; a failed resolution is not cached.
     */
    public T resolve() {
        return computation.get();
    }

    public ImmutableList<String> lineage() {
        return lineage;
    }

    @Override
    public String toString() {
        return "Deferred" + lineage;
    }
}
