package org.hardshell.loader.delegation;

import java.util.List;

/**
 * The position a given element occupies in a platform-held list, located by identity.
 */
public final class ListElementSlot implements ReferenceSlot {

    private final List<Object> list;
    private final int index;
    private final String name;

    private ListElementSlot(List<Object> list, int index, String name) {
        this.list = list;
        this.index = index;
        this.name = name;
    }

    /**
     * @return the slot, or {@code null} when {@code element} is not in the list
     */
    @SuppressWarnings("unchecked")
    public static ListElementSlot find(List<?> list, Object element, String name) {
        synchronized (list) {
            for (int i = 0; i < list.size(); i++) {
                if (list.get(i) == element) return new ListElementSlot((List<Object>) list, i, name);
            }
        }
        return null;
    }

    @Override
    public Object get() {
        synchronized (list) {
            return index < list.size() ? list.get(index) : null;
        }
    }

    @Override
    public void set(Object value) {
        synchronized (list) {
            list.set(index, value);
        }
    }

    @Override
    public String toString() {
        return name + "[" + index + "]";
    }
}
