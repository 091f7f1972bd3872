package org.hardshell.metaloader;

import android.content.Context;

import org.hardshell.loader.delegation.DeferredInitializer;

/**
 * Initializes WorkManager with the configuration the original application provides. The stub hides the
 * application from WorkManager's startup initializer, so nobody else does this.
 */
class WorkManagerInitializer implements DeferredInitializer {

    static final String CONFIGURATION_PROVIDER = "androidx.work.Configuration$Provider";

    @Override
    public String capability() {
        return CONFIGURATION_PROVIDER;
    }

    @Override
    public void initialize(Object application, Object baseContext) throws Exception {
        var cl = application.getClass().getClassLoader();
        Class<?> provider = Class.forName(CONFIGURATION_PROVIDER, false, cl);
        Object configuration = provider.getMethod("getWorkManagerConfiguration").invoke(application);
        Class<?> configurationClass = Class.forName("androidx.work.Configuration", false, cl);
        Class<?> workManager = Class.forName("androidx.work.WorkManager", true, cl);
        workManager.getMethod("initialize", Context.class, configurationClass)
                .invoke(null, (Context) application, configuration);
    }
}
