package com.radarloop.modules;

import com.google.inject.AbstractModule;
import com.google.inject.Singleton;
import com.radarloop.animation.UiDispatcher;
import com.radarloop.rendering.ColormapRegistry;
import com.radarloop.services.Level2DataManager;
import com.radarloop.services.PreferenceStore;
import com.radarloop.services.RadarDataSource;
import com.radarloop.views.SwingUiDispatcher;
import org.greenrobot.eventbus.EventBus;

/**
 * Application-wide bindings.
 */
public class DIModule extends AbstractModule {

    protected final PreferenceStore preferences;

    public DIModule(PreferenceStore preferences) {
        this.preferences = preferences;
    }

    @Override
    protected void configure() {
        bind(PreferenceStore.class).toInstance(preferences);
        bind(EventBus.class).toInstance(EventBus.builder().logNoSubscriberMessages(false).build());
        bind(ColormapRegistry.class).toInstance(ColormapRegistry.loadDefaults());
        bind(RadarDataSource.class).to(Level2DataManager.class).in(Singleton.class);
        bind(UiDispatcher.class).to(SwingUiDispatcher.class).in(Singleton.class);
    }
}
