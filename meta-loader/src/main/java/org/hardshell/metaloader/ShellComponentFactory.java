package org.hardshell.metaloader;

import android.app.Activity;
import android.app.AppComponentFactory;
import android.app.Application;
import android.app.Service;
import android.content.BroadcastReceiver;
import android.content.ContentProvider;
import android.content.Intent;
import android.content.pm.ApplicationInfo;

import org.hardshell.loader.delegation.ComponentFactoryResolver;
import org.hardshell.share.Constants;

/**
 * Declared as the component factory in hardened manifests (API 28+). Supplies the decrypted code's class loader
 * to the platform and forwards every component to the original factory when the app declared one.
 */
public class ShellComponentFactory extends AppComponentFactory {

    private volatile ComponentFactoryResolver<AppComponentFactory> resolver;

    @Override
    public ClassLoader instantiateClassLoader(ClassLoader cl, ApplicationInfo aInfo) {
        var session = ShellRuntime.loader(aInfo).prepare();
        resolver = new ComponentFactoryResolver<>(AppComponentFactory.class,
                session.originalAppComponentFactory(), ShellRuntime.logger());
        return session.classLoader();
    }

    private AppComponentFactory original(ClassLoader cl) {
        var r = resolver;
        return r == null ? null : r.resolve(cl);
    }

    @Override
    public Application instantiateApplication(ClassLoader cl, String className)
            throws InstantiationException, IllegalAccessException, ClassNotFoundException {
        if (Constants.STUB_APPLICATION.equals(className)) {
            return super.instantiateApplication(cl, className);
        }
        var factory = original(cl);
        return factory != null ? factory.instantiateApplication(cl, className) : super.instantiateApplication(cl, className);
    }

    @Override
    public Activity instantiateActivity(ClassLoader cl, String className, Intent intent)
            throws InstantiationException, IllegalAccessException, ClassNotFoundException {
        var factory = original(cl);
        return factory != null ? factory.instantiateActivity(cl, className, intent) : super.instantiateActivity(cl, className, intent);
    }

    @Override
    public BroadcastReceiver instantiateReceiver(ClassLoader cl, String className, Intent intent)
            throws InstantiationException, IllegalAccessException, ClassNotFoundException {
        var factory = original(cl);
        return factory != null ? factory.instantiateReceiver(cl, className, intent) : super.instantiateReceiver(cl, className, intent);
    }

    @Override
    public Service instantiateService(ClassLoader cl, String className, Intent intent)
            throws InstantiationException, IllegalAccessException, ClassNotFoundException {
        var factory = original(cl);
        return factory != null ? factory.instantiateService(cl, className, intent) : super.instantiateService(cl, className, intent);
    }

    @Override
    public ContentProvider instantiateProvider(ClassLoader cl, String className)
            throws InstantiationException, IllegalAccessException, ClassNotFoundException {
        if (Constants.STUB_BOOTSTRAP_PROVIDER.equals(className)) {
            return super.instantiateProvider(cl, className);
        }
        var factory = original(cl);
        return factory != null ? factory.instantiateProvider(cl, className) : super.instantiateProvider(cl, className);
    }
}
