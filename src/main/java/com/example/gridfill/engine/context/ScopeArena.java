package com.example.gridfill.engine.context;

import com.example.gridfill.engine.expression.PropertyAccess;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Index-addressed storage for binding frames. Each frame records the index of its parent; frames are appended
 * when a scope is opened and truncated when it closes, so the arena behaves as a stack that mirrors the
 * depth-first walk of the command tree.
 */
final class ScopeArena {
    static final int NO_PARENT = -1;

    private final List<Frame> frames = new ArrayList<>();

    int allocate(int parent, Map<String, ?> bindings, Object fallback) {
        frames.add(new Frame(parent, bindings, fallback));
        return frames.size() - 1;
    }

    Frame frame(int index) {
        return frames.get(index);
    }

    boolean isLive(int index, Frame expected) {
        return index < frames.size() && frames.get(index) == expected;
    }

    void release(int index) {
        if (index != frames.size() - 1) {
            throw new IllegalStateException("Scope " + index + " released out of order (open scopes: " + frames.size() + ")");
        }
        frames.remove(index);
    }

    /**
     * One immutable set of bindings. {@code fallback}, when present, is an object whose properties resolve as
     * names after the explicit bindings.
     */
    static final class Frame {
        private final int parent;
        private final Map<String, Object> bindings;
        private final Object fallback;

        Frame(int parent, Map<String, ?> bindings, Object fallback) {
            this.parent = parent;
            this.bindings = bindings == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
            this.fallback = fallback;
        }

        int parent() {
            return parent;
        }

        boolean binds(String name) {
            return bindings.containsKey(name) || (fallback != null && PropertyAccess.has(fallback, name));
        }

        Object value(String name) {
            if (bindings.containsKey(name)) {
                return bindings.get(name);
            }
            return PropertyAccess.get(fallback, name);
        }
    }
}
