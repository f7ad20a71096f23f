package com.example.gridfill.engine.context;

import com.example.gridfill.engine.expression.Scope;

import java.util.Collections;
import java.util.Map;

/**
 * Variable scope seen by expressions. A context is a handle onto one frame of a {@link ScopeArena}; lookups
 * walk from that frame toward the root. Child contexts are opened with {@link #push(Map)} and must be closed,
 * innermost first, when the subtree that uses them has been rendered:
 * <pre>
 * try (Context child = parent.push(Map.of("e", item))) {
 *     render(body, child);
 * }
 * </pre>
 */
public final class Context implements Scope, AutoCloseable {
    private final ScopeArena arena;
    private final int index;
    private final ScopeArena.Frame frame;
    private boolean closed;

    private Context(ScopeArena arena, int index) {
        this.arena = arena;
        this.index = index;
        this.frame = arena.frame(index);
    }

    /**
     * Root scope over the fill data. The root is never released; closing it is a no-op.
     */
    public static Context root(Map<String, ?> data) {
        ScopeArena arena = new ScopeArena();
        int index = arena.allocate(ScopeArena.NO_PARENT, data == null ? Collections.emptyMap() : data, null);
        return new Context(arena, index);
    }

    public Context push(Map<String, ?> bindings) {
        return pushWithFallback(bindings, null);
    }

    /**
     * Child scope whose names also resolve against the properties of {@code item}, after {@code bindings}.
     * Used for select/orderBy/groupBy expressions that name item properties without the loop variable.
     */
    public Context pushWithFallback(Map<String, ?> bindings, Object item) {
        ensureLive();
        return new Context(arena, arena.allocate(index, bindings, item));
    }

    @Override
    public boolean contains(String name) {
        ensureLive();
        for (int i = index; i != ScopeArena.NO_PARENT; i = arena.frame(i).parent()) {
            if (arena.frame(i).binds(name)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Object lookup(String name) {
        ensureLive();
        for (int i = index; i != ScopeArena.NO_PARENT; i = arena.frame(i).parent()) {
            ScopeArena.Frame current = arena.frame(i);
            if (current.binds(name)) {
                return current.value(name);
            }
        }
        return null;
    }

    /**
     * Number of frames between this scope and the root, the root being depth 0.
     */
    public int depth() {
        int depth = 0;
        for (int i = arena.frame(index).parent(); i != ScopeArena.NO_PARENT; i = arena.frame(i).parent()) {
            depth++;
        }
        return depth;
    }

    @Override
    public void close() {
        if (closed || frame.parent() == ScopeArena.NO_PARENT) {
            return;
        }
        arena.release(index);
        closed = true;
    }

    private void ensureLive() {
        if (closed || !arena.isLive(index, frame)) {
            throw new IllegalStateException("Context scope used after it was closed");
        }
    }
}
