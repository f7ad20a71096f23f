package com.example.gridfill.engine.transform;

import com.example.gridfill.engine.command.EachCommand;
import com.example.gridfill.engine.command.GroupOrder;
import com.example.gridfill.engine.command.SortKey;
import com.example.gridfill.engine.context.Context;
import com.example.gridfill.engine.expression.Coercions;
import com.example.gridfill.engine.grid.CellRef;
import com.example.gridfill.exception.ExpressionEvaluationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns the {@code items} of an each into the sequence it iterates: select first, then groupBy, then orderBy.
 * With groupBy, orderBy sorts the members of each group and the groups keep first-seen order unless
 * {@code groupOrder} says otherwise.
 * <p>
 * Inside select, groupBy and orderBy the current item is bound to the loop variable and its properties also
 * resolve unqualified, so {@code salary >= 6000} reads the same as {@code e.salary >= 6000}.
 */
@Slf4j
class CollectionResolver {
    private final FillSession session;

    CollectionResolver(FillSession session) {
        this.session = session;
    }

    List<Object> resolve(EachCommand each, Context scope) {
        CellRef anchor = each.getRegion().getAnchor();
        List<Object> items = evaluateItems(each, scope, anchor);
        if (each.getSelect() != null) {
            items = select(each, items, scope, anchor);
        }
        if (each.getGroupBy() != null) {
            return group(each, items, scope, anchor);
        }
        if (each.getOrderBy() != null) {
            items = order(each, items, scope, anchor);
        }
        log.debug("{} resolved {} item(s)", each.describe(), items.size());
        return items;
    }

    private List<Object> evaluateItems(EachCommand each, Context scope, CellRef anchor) {
        try {
            return Coercions.toList(session.evaluate(each.getItems(), scope));
        } catch (ExpressionEvaluationException e) {
            session.recover(e, anchor, null);
            return new ArrayList<>();
        }
    }

    private List<Object> select(EachCommand each, List<Object> items, Context scope, CellRef anchor) {
        List<Object> kept = new ArrayList<>();
        for (Object item : items) {
            try (Context itemScope = itemScope(each, item, scope)) {
                if (session.getEvaluator().evaluateCondition(each.getSelect(), itemScope)) {
                    kept.add(item);
                }
            } catch (ExpressionEvaluationException e) {
                session.recover(e, anchor, null);
            }
        }
        return kept;
    }

    private List<Object> group(EachCommand each, List<Object> items, Context scope, CellRef anchor) {
        List<Object> keys = new ArrayList<>();
        List<List<Object>> members = new ArrayList<>();
        for (Object item : items) {
            Object key = evaluateKey(each, each.getGroupBy(), item, scope, anchor);
            int index = indexOfKey(keys, key);
            if (index < 0) {
                keys.add(key);
                members.add(new ArrayList<>());
                index = keys.size() - 1;
            }
            members.get(index).add(item);
        }
        List<GroupData> groups = new ArrayList<>();
        for (int i = 0; i < keys.size(); i++) {
            List<Object> groupItems = each.getOrderBy() == null
                    ? members.get(i)
                    : order(each, members.get(i), scope, anchor);
            groups.add(new GroupData(keys.get(i), groupItems.get(0), Collections.unmodifiableList(new ArrayList<>(groupItems))));
        }
        if (each.getGroupOrder() != null) {
            groups.sort(groupComparator(each.getGroupOrder()));
        }
        log.debug("{} grouped {} item(s) into {} group(s)", each.describe(), items.size(), groups.size());
        return new ArrayList<>(groups);
    }

    private List<Object> order(EachCommand each, List<Object> items, Context scope, CellRef anchor) {
        List<SortKey> sortKeys = each.getSortKeys();
        List<Keyed> keyed = new ArrayList<>(items.size());
        for (Object item : items) {
            Object[] values = new Object[sortKeys.size()];
            for (int k = 0; k < sortKeys.size(); k++) {
                values[k] = evaluateKey(each, sortKeys.get(k).getExpression(), item, scope, anchor);
            }
            keyed.add(new Keyed(item, values));
        }
        // List.sort is stable, so equal keys keep their input order
        keyed.sort((a, b) -> {
            for (int k = 0; k < sortKeys.size(); k++) {
                int result = Coercions.sortCompare(a.keys[k], b.keys[k]);
                if (result != 0) {
                    return sortKeys.get(k).isDescending() ? -result : result;
                }
            }
            return 0;
        });
        List<Object> sorted = new ArrayList<>(keyed.size());
        for (Keyed entry : keyed) {
            sorted.add(entry.item);
        }
        return sorted;
    }

    private Object evaluateKey(EachCommand each, String expression, Object item, Context scope, CellRef anchor) {
        try (Context itemScope = itemScope(each, item, scope)) {
            return session.getEvaluator().evaluate(expression, itemScope);
        } catch (ExpressionEvaluationException e) {
            session.recover(e, anchor, null);
            return null;
        }
    }

    private Context itemScope(EachCommand each, Object item, Context scope) {
        Map<String, Object> bindings = new HashMap<>();
        bindings.put(each.getVar(), item);
        return scope.pushWithFallback(bindings, item);
    }

    private static int indexOfKey(List<Object> keys, Object key) {
        for (int i = 0; i < keys.size(); i++) {
            if (Coercions.equal(keys.get(i), key)) {
                return i;
            }
        }
        return -1;
    }

    private static Comparator<GroupData> groupComparator(GroupOrder order) {
        Comparator<GroupData> comparator = (a, b) -> {
            Object left = a.getKey();
            Object right = b.getKey();
            if (order.isIgnoreCase() && left instanceof CharSequence && right instanceof CharSequence) {
                return left.toString().toLowerCase(Locale.ROOT).compareTo(right.toString().toLowerCase(Locale.ROOT));
            }
            return Coercions.sortCompare(left, right);
        };
        return order.isDescending() ? comparator.reversed() : comparator;
    }

    private static final class Keyed {
        private final Object item;
        private final Object[] keys;

        private Keyed(Object item, Object[] keys) {
            this.item = item;
            this.keys = keys;
        }
    }
}
