package org.hardshell.loader.delegation;

import org.hardshell.loader.util.Reflection;

import java.lang.reflect.Field;

public final class FieldSlot implements ReferenceSlot {

    private final Object holder;
    private final Field field;

    private FieldSlot(Object holder, Field field) {
        this.holder = holder;
        this.field = field;
    }

    public static FieldSlot of(Object holder, String fieldName) throws NoSuchFieldException {
        return new FieldSlot(holder, Reflection.findField(holder.getClass(), fieldName));
    }

    @Override
    public Object get() throws IllegalAccessException {
        return field.get(holder);
    }

    @Override
    public void set(Object value) throws IllegalAccessException {
        field.set(holder, value);
    }

    @Override
    public String toString() {
        return holder.getClass().getSimpleName() + "." + field.getName();
    }
}
