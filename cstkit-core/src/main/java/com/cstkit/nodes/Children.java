package com.cstkit.nodes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Flattens child slots of any shape into the list returned by
 * {@link CstNode#children()}.
 */
final class Children {

    private Children() {
    }

    static List<CstNode> of(Object... slots) {
        List<CstNode> children = new ArrayList<>();
        for (Object slot : slots) {
            if (slot == null) {
                continue;
            }
            if (slot instanceof CstNode node) {
                children.add(node);
            } else if (slot instanceof MaybeSentinel<?> sentinel) {
                CstNode node = sentinel.orNull();
                if (node != null) {
                    children.add(node);
                }
            } else if (slot instanceof Collection<?> nodes) {
                for (Object node : nodes) {
                    children.add((CstNode) node);
                }
            } else {
                throw new IllegalArgumentException("Not a child slot: " + slot.getClass().getName());
            }
        }
        return Collections.unmodifiableList(children);
    }
}
