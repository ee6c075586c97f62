package com.radarloop.animation;

import com.radarloop.rendering.FrameRenderer;
import com.radarloop.services.FrameLoader;
import com.radarloop.services.PreferenceStore;
import com.radarloop.services.RadarDataSource;
import org.greenrobot.eventbus.EventBus;

import javax.inject.Inject;

/**
 * Builds one {@link AnimationSession} per site from the shared application services.
 */
public class AnimationSessionFactory {

    @Inject
    protected PreferenceStore preferences;

    @Inject
    protected RadarDataSource dataSource;

    @Inject
    protected UiDispatcher ui;

    @Inject
    protected EventBus eventBus;

    public AnimationSession create(String site, FrameRenderer renderer) {
        return new AnimationSession(site, new FrameLoader(dataSource), renderer, ui, eventBus, preferences);
    }
}
