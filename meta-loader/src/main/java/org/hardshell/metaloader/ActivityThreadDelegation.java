package org.hardshell.metaloader;

import android.app.Application;
import android.content.pm.ApplicationInfo;

import org.hardshell.loader.delegation.DelegationStrategy;
import org.hardshell.loader.delegation.FieldSlot;
import org.hardshell.loader.delegation.ListElementSlot;
import org.hardshell.loader.delegation.ReferenceSwap;
import org.hardshell.loader.util.Reflection;

import java.util.List;

/**
 * Application references held by {@code ActivityThread} and friends, unchanged from Nougat through API 35:
 * {@code mInitialApplication}, {@code mAllApplications}, {@code LoadedApk.mApplication},
 * {@code ContextImpl.mOuterContext} and the class name in the bound {@link ApplicationInfo}.
 */
class ActivityThreadDelegation implements DelegationStrategy {

    static final int MIN_SDK = 24;
    static final int MAX_SDK = 35;

    @Override
    public ReferenceSwap prepareSwap(Object stub, Object original) throws ReflectiveOperationException {
        Class<?> activityThreadClass = Class.forName("android.app.ActivityThread");
        Object thread = Reflection.callStaticMethod(activityThreadClass, "currentActivityThread");
        Object boundApplication = Reflection.getObjectField(thread, "mBoundApplication");
        Object loadedApk = Reflection.getObjectField(boundApplication, "info");
        Object contextImpl = ((Application) stub).getBaseContext();

        var swap = new ReferenceSwap()
                .replace(FieldSlot.of(thread, "mInitialApplication"), stub, original);
        @SuppressWarnings("unchecked")
        var all = (List<Object>) Reflection.getObjectField(thread, "mAllApplications");
        var element = ListElementSlot.find(all, stub, "mAllApplications");
        if (element != null) swap.replace(element, stub, original);
        swap.replace(FieldSlot.of(loadedApk, "mApplication"), stub, original);
        swap.replace(FieldSlot.of(contextImpl, "mOuterContext"), stub, original);

        String originalName = original.getClass().getName();
        var loadedInfo = (ApplicationInfo) Reflection.getObjectField(loadedApk, "mApplicationInfo");
        swap.replace(FieldSlot.of(loadedInfo, "className"), loadedInfo.className, originalName);
        var boundInfo = (ApplicationInfo) Reflection.getObjectField(boundApplication, "appInfo");
        if (boundInfo != loadedInfo) {
            swap.replace(FieldSlot.of(boundInfo, "className"), boundInfo.className, originalName);
        }
        return swap;
    }
}
