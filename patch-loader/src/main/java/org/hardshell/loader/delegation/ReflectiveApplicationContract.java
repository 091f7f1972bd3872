package org.hardshell.loader.delegation;

import org.hardshell.loader.util.Reflection;

import java.lang.reflect.Constructor;

public class ReflectiveApplicationContract implements ApplicationContract {

    private final String attachMethod;
    private final String startMethod;

    /**
     * @param attachMethod name of the one-argument method taking the base context
     * @param startMethod  name of the no-argument startup callback
     */
    public ReflectiveApplicationContract(String attachMethod, String startMethod) {
        this.attachMethod = attachMethod;
        this.startMethod = startMethod;
    }

    @Override
    public Object construct(ClassLoader loader, String className) throws ReflectiveOperationException {
        Class<?> clazz = Class.forName(className, true, loader);
        Constructor<?> constructor = clazz.getDeclaredConstructor();
        constructor.setAccessible(true);
        return constructor.newInstance();
    }

    @Override
    public void attach(Object application, Object baseContext) throws ReflectiveOperationException {
        var method = Reflection.findMethod(application.getClass(), attachMethod, baseContext.getClass());
        Reflection.invoke(method, application, baseContext);
    }

    @Override
    public void start(Object application) throws ReflectiveOperationException {
        Reflection.invoke(Reflection.findMethod(application.getClass(), startMethod), application);
    }

    @Override
    public boolean probe(Object application, String capability) {
        return Reflection.implementsInterface(application.getClass(), capability);
    }
}
