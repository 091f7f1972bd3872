package org.hardshell.loader.util;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.HashMap;
import java.util.Map;

/**
 * Field and method lookup across a class hierarchy, cached per class and name.
 */
public final class Reflection {

    private static final Map<String, Field> fieldCache = new HashMap<>();

    private Reflection() {
    }

    public static Field findField(Class<?> clazz, String fieldName) throws NoSuchFieldException {
        String key = clazz.getName() + '#' + fieldName;
        synchronized (fieldCache) {
            Field cached = fieldCache.get(key);
            if (cached != null) return cached;
        }
        for (Class<?> c = clazz; c != null; c = c.getSuperclass()) {
            try {
                Field field = c.getDeclaredField(fieldName);
                field.setAccessible(true);
                synchronized (fieldCache) {
                    fieldCache.put(key, field);
                }
                return field;
            } catch (NoSuchFieldException ignored) {
                // keep walking up
            }
        }
        throw new NoSuchFieldException(clazz.getName() + "#" + fieldName);
    }

    public static Object getObjectField(Object obj, String fieldName) throws ReflectiveOperationException {
        return findField(obj.getClass(), fieldName).get(obj);
    }

    public static void setObjectField(Object obj, String fieldName, Object value) throws ReflectiveOperationException {
        findField(obj.getClass(), fieldName).set(obj, value);
    }

    public static Object getStaticObjectField(Class<?> clazz, String fieldName) throws ReflectiveOperationException {
        return findField(clazz, fieldName).get(null);
    }

    /**
     * Finds a method by name and arity whose parameters accept the given argument types.
     */
    public static Method findMethod(Class<?> clazz, String methodName, Class<?>... argTypes) throws NoSuchMethodException {
        for (Class<?> c = clazz; c != null; c = c.getSuperclass()) {
            for (Method method : c.getDeclaredMethods()) {
                if (method.getName().equals(methodName) && accepts(method.getParameterTypes(), argTypes)) {
                    method.setAccessible(true);
                    return method;
                }
            }
        }
        throw new NoSuchMethodException(clazz.getName() + "#" + methodName);
    }

    private static boolean accepts(Class<?>[] params, Class<?>[] args) {
        if (params.length != args.length) return false;
        for (int i = 0; i < params.length; i++) {
            if (args[i] != null && !params[i].isAssignableFrom(args[i])) return false;
        }
        return true;
    }

    /**
     * Invokes a method, rethrowing unchecked exceptions and errors thrown by the target as they are.
     */
    public static Object invoke(Method method, Object receiver, Object... args) throws ReflectiveOperationException {
        try {
            return method.invoke(receiver, args);
        } catch (InvocationTargetException e) {
            var cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw e;
        }
    }

    public static Object callStaticMethod(Class<?> clazz, String methodName) throws ReflectiveOperationException {
        return invoke(findMethod(clazz, methodName), null);
    }

    public static boolean implementsInterface(Class<?> clazz, String interfaceName) {
        for (Class<?> c = clazz; c != null; c = c.getSuperclass()) {
            for (Class<?> i : c.getInterfaces()) {
                if (i.getName().equals(interfaceName) || implementsInterface(i, interfaceName)) return true;
            }
        }
        return false;
    }
}
