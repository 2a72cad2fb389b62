package com.meridian.security.visibility;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A predicate over rows, built from field comparisons and boolean combinators.
 * <p>
 * Filters can be evaluated in memory with {@link #test(FieldSource)} or translated into a
 * storage query language through a {@link Visitor}. The factories simplify trivially:
 * {@code anyOf} containing {@link #all()} is {@code all()}, {@code allOf} containing
 * {@link #none()} is {@code none()}.
 */
public interface RowFilter {

    boolean test(FieldSource row);

    <R> R accept(Visitor<R> visitor);

    static RowFilter all() {
        return All.INSTANCE;
    }

    static RowFilter none() {
        return None.INSTANCE;
    }

    /** {@code field = value}; a null value means the field is null. */
    static RowFilter equalTo(String field, Object value) {
        return new EqualTo(field, value);
    }

    /** {@code field IN (values)}; an empty set matches nothing. */
    static RowFilter in(String field, Collection<?> values) {
        if (values.isEmpty()) {
            return none();
        }
        return new In(field, Set.copyOf(values));
    }

    static RowFilter anyOf(RowFilter... filters) {
        List<RowFilter> kept = new ArrayList<>();
        for (RowFilter filter : filters) {
            if (filter == All.INSTANCE) {
                return all();
            }
            if (filter != None.INSTANCE) {
                kept.add(filter);
            }
        }
        if (kept.isEmpty()) {
            return none();
        }
        return kept.size() == 1 ? kept.get(0) : new AnyOf(kept);
    }

    static RowFilter allOf(RowFilter... filters) {
        List<RowFilter> kept = new ArrayList<>();
        for (RowFilter filter : filters) {
            if (filter == None.INSTANCE) {
                return none();
            }
            if (filter != All.INSTANCE) {
                kept.add(filter);
            }
        }
        if (kept.isEmpty()) {
            return all();
        }
        return kept.size() == 1 ? kept.get(0) : new AllOf(kept);
    }

    static RowFilter not(RowFilter filter) {
        if (filter == All.INSTANCE) {
            return none();
        }
        if (filter == None.INSTANCE) {
            return all();
        }
        if (filter instanceof Not negated) {
            return negated.filter();
        }
        return new Not(filter);
    }

    default RowFilter or(RowFilter other) {
        return anyOf(this, other);
    }

    default RowFilter and(RowFilter other) {
        return allOf(this, other);
    }

    /**
     * Translation hook for storage layers.
     *
     * @param <R> result of the translation, e.g. a query predicate
     */
    interface Visitor<R> {

        R visitAll();

        R visitNone();

        R visitEqualTo(EqualTo filter);

        R visitIn(In filter);

        R visitAnyOf(AnyOf filter);

        R visitAllOf(AllOf filter);

        R visitNot(Not filter);
    }

    final class All implements RowFilter {

        static final All INSTANCE = new All();

        private All() {
        }

        @Override
        public boolean test(FieldSource row) {
            return true;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAll();
        }

        @Override
        public String toString() {
            return "all";
        }
    }

    final class None implements RowFilter {

        static final None INSTANCE = new None();

        private None() {
        }

        @Override
        public boolean test(FieldSource row) {
            return false;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNone();
        }

        @Override
        public String toString() {
            return "none";
        }
    }

    record EqualTo(String field, Object value) implements RowFilter {

        public EqualTo {
            Objects.requireNonNull(field, "field");
        }

        @Override
        public boolean test(FieldSource row) {
            return Objects.equals(row.field(field), value);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEqualTo(this);
        }
    }

    record In(String field, Set<?> values) implements RowFilter {

        public In {
            Objects.requireNonNull(field, "field");
        }

        @Override
        public boolean test(FieldSource row) {
            Object value = row.field(field);
            return value != null && values.contains(value);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIn(this);
        }
    }

    record AnyOf(List<RowFilter> filters) implements RowFilter {

        public AnyOf {
            filters = List.copyOf(filters);
        }

        @Override
        public boolean test(FieldSource row) {
            return filters.stream().anyMatch(f -> f.test(row));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAnyOf(this);
        }
    }

    record AllOf(List<RowFilter> filters) implements RowFilter {

        public AllOf {
            filters = List.copyOf(filters);
        }

        @Override
        public boolean test(FieldSource row) {
            return filters.stream().allMatch(f -> f.test(row));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAllOf(this);
        }
    }

    record Not(RowFilter filter) implements RowFilter {

        public Not {
            Objects.requireNonNull(filter, "filter");
        }

        @Override
        public boolean test(FieldSource row) {
            return !filter.test(row);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNot(this);
        }
    }
}
