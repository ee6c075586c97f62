package com.radarloop.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.radarloop.animation.AnimationSession;
import com.radarloop.animation.AnimationSessionFactory;
import com.radarloop.animation.UiDispatcher;
import com.radarloop.exception.RadarLoopException;
import com.radarloop.modules.DIModule;
import com.radarloop.rendering.ColormapRegistry;
import com.radarloop.rendering.SweepImageRenderer;
import com.radarloop.services.PreferenceStore;
import com.radarloop.services.PropertiesPreferenceStore;
import com.radarloop.util.RadarFileUtils;
import com.radarloop.views.AnimationControlPanel;
import com.radarloop.views.RadarSweepView;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.greenrobot.eventbus.EventBus;

import javax.inject.Inject;
import javax.swing.JFrame;
import javax.swing.JOptionPane;
import javax.swing.SwingUtilities;
import java.awt.BorderLayout;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.io.File;

/**
 * Desktop entry point: one window animating one radar site.
 * <p>
 * Usage: {@code RadarLoopApp [SITE] [settings-file]}
 */
public class RadarLoopApp {

    protected static final String TAG = "RadarLoopApp";

    private static final Logger LOG = LogManager.getLogger(TAG);

    @Inject
    protected PreferenceStore preferences;

    @Inject
    protected EventBus eventBus;

    @Inject
    protected UiDispatcher ui;

    @Inject
    protected ColormapRegistry colormaps;

    @Inject
    protected AnimationSessionFactory sessionFactory;

    protected JFrame window;
    protected RadarSweepView sweepView;
    protected AnimationControlPanel controlPanel;
    protected RadarSite radarSite;

    public static void main(final String[] args) {
        String settingsPath = args.length > 1 ? args[1] : Settings.USER_SETTINGS_FILE;
        final PreferenceStore preferences;
        try {
            preferences = PropertiesPreferenceStore.load(RadarFileUtils.expandHome(settingsPath));
        } catch (RadarLoopException ex) {
            LOG.fatal("cannot load settings", ex);
            System.exit(1);
            return;
        }
        final String site = (args.length > 0 ? args[0]
                : preferences.getString(Settings.KEY_PREF_DEFAULT_SITE, Settings.DEFAULT_SITE)).toUpperCase();
        SwingUtilities.invokeLater(new Runnable() {
            @Override
            public void run() {
                RadarLoopApp app = new RadarLoopApp();
                Injector injector = Guice.createInjector(new DIModule(preferences));
                injector.injectMembers(app);
                app.open(site);
            }
        });
    }

    protected void open(String site) {
        LOG.info("opening radar site " + site);
        sweepView = new RadarSweepView(site, new SweepImageRenderer(colormaps));
        AnimationSession session = sessionFactory.create(site, sweepView);
        radarSite = new RadarSite(site, session, ui);
        controlPanel = new AnimationControlPanel(radarSite, eventBus);

        window = new JFrame("RadarLoop - " + site);
        window.setDefaultCloseOperation(JFrame.DO_NOTHING_ON_CLOSE);
        window.getContentPane().add(sweepView, BorderLayout.CENTER);
        window.getContentPane().add(controlPanel, BorderLayout.SOUTH);
        window.addWindowListener(new WindowAdapter() {
            @Override
            public void windowClosing(WindowEvent e) {
                close();
            }
        });
        window.pack();
        window.setLocationByPlatform(true);
        window.setVisible(true);

        radarSite.load();
        try {
            radarSite.setAnimationRequested(true);
        } catch (RadarLoopException ex) {
            LOG.error("cannot start animation for " + site, ex);
            JOptionPane.showMessageDialog(window, ex.getMessage(), "RadarLoop", JOptionPane.ERROR_MESSAGE);
        }
    }

    protected void close() {
        LOG.info("closing " + radarSite.getSite());
        radarSite.getSession().stopAndJoin();
        controlPanel.dispose();
        sweepView.dispose();
        window.dispose();
    }
}
