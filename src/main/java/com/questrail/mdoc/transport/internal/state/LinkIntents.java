package com.questrail.mdoc.transport.internal.state;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * LinkIntents
 * -----------------------------------------------------------------------------
 * Immutable, ordered list of {@link LinkAction}s emitted by the
 * {@link LinkReducer}.
 *
 * <p>The reducer decides <b>what</b> should happen next; the executor decides
 * <b>how</b>. Order matters: a socket is closed before the sentinel lingers,
 * and listener notifications follow the platform actions of the same step.</p>
 */
public final class LinkIntents
{
    private static final LinkIntents NONE = new LinkIntents(List.of());

    private final List<LinkAction> actions;

    private LinkIntents(List<LinkAction> actions) {
        this.actions = List.copyOf(actions);
    }

    public static LinkIntents none() {
        return NONE;
    }

    public static LinkIntents of(LinkAction... actions) {
        return new LinkIntents(List.of(actions));
    }

    public List<LinkAction> actions() {
        return actions;
    }

    public boolean isEmpty() {
        return actions.isEmpty();
    }

    public boolean contains(Class<? extends LinkAction> type) {
        return actions.stream().anyMatch(type::isInstance);
    }

    /**
     * First action of the given type, if any.
     */
    public <A extends LinkAction> Optional<A> first(Class<A> type) {
        return actions.stream().filter(type::isInstance).map(type::cast).findFirst();
    }

    /**
     * All actions of the given type, in emission order.
     */
    public <A extends LinkAction> List<A> all(Class<A> type) {
        return actions.stream().filter(type::isInstance).map(type::cast).toList();
    }

    /**
     * Concatenates this list with {@code other}.
     */
    public LinkIntents and(LinkIntents other) {
        Objects.requireNonNull(other, "other");
        if (other.isEmpty()) {
            return this;
        }
        List<LinkAction> merged = new ArrayList<>(actions);
        merged.addAll(other.actions);
        return new LinkIntents(merged);
    }

    @Override
    public String toString() {
        return actions.toString();
    }

    // ---------------------------------------------------------------------
    // Builder (reducer-friendly)
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<LinkAction> actions = new ArrayList<>();

        private Builder() {}

        public Builder add(LinkAction action) {
            actions.add(Objects.requireNonNull(action, "action"));
            return this;
        }

        public LinkIntents build() {
            return actions.isEmpty() ? NONE : new LinkIntents(actions);
        }
    }
}
