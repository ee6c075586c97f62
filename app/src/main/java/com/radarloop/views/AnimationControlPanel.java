package com.radarloop.views;

import com.radarloop.animation.AnimationSession;
import com.radarloop.animation.PlaybackCommand;
import com.radarloop.app.RadarSite;
import com.radarloop.exception.ConfigurationException;
import com.radarloop.model.AnimationStatusEvent;
import com.radarloop.model.AppMessage;
import com.radarloop.model.FrameLoadProgressEvent;
import com.radarloop.model.PlaybackState;
import com.radarloop.model.RayTime;
import com.radarloop.model.SubFrame;
import com.radarloop.model.SweepSelection;
import com.radarloop.model.VolumeType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.greenrobot.eventbus.EventBus;
import org.greenrobot.eventbus.Subscribe;

import javax.swing.AbstractAction;
import javax.swing.BorderFactory;
import javax.swing.BoxLayout;
import javax.swing.InputMap;
import javax.swing.JButton;
import javax.swing.JCheckBox;
import javax.swing.JComboBox;
import javax.swing.JComponent;
import javax.swing.JLabel;
import javax.swing.JPanel;
import javax.swing.JProgressBar;
import javax.swing.JSlider;
import javax.swing.JToggleButton;
import javax.swing.KeyStroke;
import javax.swing.event.ChangeEvent;
import javax.swing.event.ChangeListener;
import java.awt.BorderLayout;
import java.awt.CardLayout;
import java.awt.Cursor;
import java.awt.Desktop;
import java.awt.FlowLayout;
import java.awt.event.ActionEvent;
import java.awt.event.ActionListener;
import java.awt.event.MouseAdapter;
import java.awt.event.MouseEvent;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * Controls for one site's animation: play/stop, pause/resume, single steps, a progress bar, a
 * checkbox per frame and the volume, elevation and iso-level selectors. Keyboard shortcuts
 * {@code ,} {@code .} {@code /} work anywhere in the window holding the panel. When the
 * animation fails the controls are replaced by the error message.
 */
public class AnimationControlPanel extends JPanel {

    public static final String TAG = "AnimationControlPanel";

    private static final Logger LOG = LogManager.getLogger(TAG);

    protected static final String CARD_CONTROLS = "controls";
    protected static final String CARD_ERROR = "error";
    protected static final int ISO_OFF = 0;

    protected final RadarSite radarSite;
    protected final AnimationSession session;
    protected final EventBus eventBus;

    protected final CardLayout cards = new CardLayout();
    protected final JToggleButton playButton = new JToggleButton("Play");
    protected final JToggleButton pauseButton = new JToggleButton("Pause");
    protected final JButton backButton = new JButton("<");
    protected final JButton forwardButton = new JButton(">");
    protected final JProgressBar progressBar = new JProgressBar(0, 100);
    protected final JLabel timeLabel = new JLabel(" ");
    protected final JPanel framePanel = new JPanel(new FlowLayout(FlowLayout.LEFT, 2, 0));
    protected final List<JCheckBox> frameBoxes = new ArrayList<JCheckBox>();
    protected final JComboBox<VolumeType> volumeBox = new JComboBox<VolumeType>(VolumeType.values());
    protected final JComboBox<Float> elevationBox = new JComboBox<Float>();
    protected final JSlider isoSlider = new JSlider(ISO_OFF, 75, ISO_OFF);
    protected final JLabel errorLabel = new JLabel();
    protected final JLabel linkLabel = new JLabel();

    protected boolean updating;
    protected String errorLink;

    public AnimationControlPanel(RadarSite radarSite, EventBus eventBus) {
        super();
        this.radarSite = radarSite;
        this.session = radarSite.getSession();
        this.eventBus = eventBus;
        setLayout(cards);
        add(buildControls(), CARD_CONTROLS);
        add(buildErrorPanel(), CARD_ERROR);
        bindKeys();
        eventBus.register(this);
    }

    protected JPanel buildControls() {
        JPanel controls = new JPanel();
        controls.setLayout(new BoxLayout(controls, BoxLayout.Y_AXIS));

        JPanel buttons = new JPanel(new FlowLayout(FlowLayout.LEFT));
        buttons.add(playButton);
        buttons.add(pauseButton);
        buttons.add(backButton);
        buttons.add(forwardButton);
        buttons.add(timeLabel);
        controls.add(buttons);

        progressBar.setStringPainted(true);
        controls.add(progressBar);

        framePanel.setBorder(BorderFactory.createTitledBorder("Frames"));
        controls.add(framePanel);

        JPanel selectors = new JPanel(new FlowLayout(FlowLayout.LEFT));
        selectors.add(new JLabel("Volume"));
        selectors.add(volumeBox);
        selectors.add(new JLabel("Elevation"));
        selectors.add(elevationBox);
        selectors.add(new JLabel("Iso dBZ"));
        isoSlider.setMajorTickSpacing(15);
        isoSlider.setPaintTicks(true);
        isoSlider.setPaintLabels(true);
        selectors.add(isoSlider);
        controls.add(selectors);

        playButton.addActionListener(new ActionListener() {
            @Override
            public void actionPerformed(ActionEvent e) {
                togglePlay(playButton.isSelected());
            }
        });
        pauseButton.addActionListener(new ActionListener() {
            @Override
            public void actionPerformed(ActionEvent e) {
                session.dispatch(PlaybackCommand.TOGGLE_PAUSE);
            }
        });
        backButton.addActionListener(new ActionListener() {
            @Override
            public void actionPerformed(ActionEvent e) {
                session.dispatch(PlaybackCommand.STEP_BACKWARD);
            }
        });
        forwardButton.addActionListener(new ActionListener() {
            @Override
            public void actionPerformed(ActionEvent e) {
                session.dispatch(PlaybackCommand.STEP_FORWARD);
            }
        });
        ActionListener selectionListener = new ActionListener() {
            @Override
            public void actionPerformed(ActionEvent e) {
                if (!updating) {
                    selectionChanged(e.getSource() == volumeBox);
                }
            }
        };
        volumeBox.addActionListener(selectionListener);
        elevationBox.addActionListener(selectionListener);
        isoSlider.addChangeListener(new ChangeListener() {
            @Override
            public void stateChanged(ChangeEvent e) {
                if (!isoSlider.getValueIsAdjusting()) {
                    int value = isoSlider.getValue();
                    session.setIsoLevel(value == ISO_OFF ? Float.NaN : value);
                }
            }
        });
        return controls;
    }

    protected JPanel buildErrorPanel() {
        JPanel panel = new JPanel(new BorderLayout());
        panel.setBorder(BorderFactory.createEmptyBorder(8, 8, 8, 8));
        panel.add(errorLabel, BorderLayout.CENTER);
        linkLabel.setCursor(Cursor.getPredefinedCursor(Cursor.HAND_CURSOR));
        linkLabel.addMouseListener(new MouseAdapter() {
            @Override
            public void mouseClicked(MouseEvent e) {
                openLink();
            }
        });
        panel.add(linkLabel, BorderLayout.SOUTH);
        return panel;
    }

    protected void bindKeys() {
        InputMap inputMap = getInputMap(JComponent.WHEN_IN_FOCUSED_WINDOW);
        for (final char key : new char[]{',', '.', '/'}) {
            final PlaybackCommand command = PlaybackCommand.fromKey(key);
            String actionKey = "animation-" + command.name();
            inputMap.put(KeyStroke.getKeyStroke(key), actionKey);
            getActionMap().put(actionKey, new AbstractAction() {
                @Override
                public void actionPerformed(ActionEvent e) {
                    session.dispatch(command);
                }
            });
        }
    }

    protected void togglePlay(boolean requested) {
        try {
            radarSite.setAnimationRequested(requested);
        } catch (ConfigurationException ex) {
            LOG.error("cannot animate " + radarSite.getSite() + ": " + ex.getMessage());
            playButton.setSelected(false);
            eventBus.post(new AppMessage(radarSite.getSite(), ex.getMessage(), AppMessage.Type.ERROR, null));
        }
    }

    protected void selectionChanged(boolean volumeChanged) {
        VolumeType volume = (VolumeType) volumeBox.getSelectedItem();
        if (volume == null) {
            return;
        }
        if (volumeChanged) {
            refreshElevations(volume.getId(), session.getSelection());
        }
        Float elevation = (Float) elevationBox.getSelectedItem();
        if (elevation != null) {
            session.selectSweep(volume.getId(), elevation);
        }
    }

    protected void refreshElevations(int volumeId, SweepSelection selection) {
        updating = true;
        try {
            elevationBox.removeAllItems();
            Float closest = null;
            for (Float elevation : session.getElevations(volumeId)) {
                elevationBox.addItem(elevation);
                if (selection != null && (closest == null
                        || Math.abs(elevation - selection.getElevation()) < Math.abs(closest - selection.getElevation()))) {
                    closest = elevation;
                }
            }
            if (closest != null) {
                elevationBox.setSelectedItem(closest);
            }
        } finally {
            updating = false;
        }
    }

    @Subscribe
    public void onEvent(AnimationStatusEvent event) {
        if (!radarSite.getSite().equals(event.getSite())) {
            return;
        }
        updating = true;
        try {
            PlaybackState state = event.getState();
            playButton.setSelected(state.isActive());
            pauseButton.setSelected(event.getState() == PlaybackState.PAUSED);
            boolean running = state == PlaybackState.PLAYING || state == PlaybackState.PAUSED;
            pauseButton.setEnabled(running);
            backButton.setEnabled(running);
            forwardButton.setEnabled(running);
            if (state == PlaybackState.LOADING) {
                progressBar.setValue(session.getLoadPercent());
                progressBar.setString("Loading " + session.getLoadPercent() + "%");
            } else {
                progressBar.setValue(event.getLoopPercent());
                progressBar.setString(event.getFrameCount() > 0
                        ? "Frame " + (event.getFrameIndex() + 1) + "/" + event.getFrameCount() : "");
            }
            SubFrame current = event.getCurrentSubFrame();
            timeLabel.setText(current == null ? " " : RayTime.formatRange(current.getStart(), current.getFinish()));
            syncFrameBoxes(event);
            if (running && elevationBox.getItemCount() == 0) {
                SweepSelection selection = session.getSelection();
                if (selection != null) {
                    volumeBox.setSelectedItem(VolumeType.forId(selection.getVolumeId()));
                    refreshElevations(selection.getVolumeId(), selection);
                }
            }
            if (state.isActive() && event.getErrorMessage() == null) {
                cards.show(this, CARD_CONTROLS);
            }
        } finally {
            updating = false;
        }
    }

    @Subscribe
    public void onEvent(FrameLoadProgressEvent event) {
        if (!radarSite.getSite().equals(event.getSite())) {
            return;
        }
        int percent = (int) Math.round(event.getFraction() * 100);
        progressBar.setValue(percent);
        progressBar.setString("Loading " + (event.getSlot() + 1) + "/" + event.getSlotCount() + " " + percent + "%");
    }

    @Subscribe
    public void onEvent(AppMessage message) {
        if (message.getType() != AppMessage.Type.ERROR || !radarSite.getSite().equals(message.getSite())) {
            return;
        }
        errorLabel.setText("<html>" + escape(message.getMessage()) + "</html>");
        errorLink = message.getLink();
        linkLabel.setText(errorLink == null ? "" : "<html><a href=\"\">" + escape(errorLink) + "</a></html>");
        cards.show(this, CARD_ERROR);
    }

    protected void syncFrameBoxes(AnimationStatusEvent event) {
        int count = event.getFrameCount();
        if (frameBoxes.size() != count) {
            framePanel.removeAll();
            frameBoxes.clear();
            for (int index = 0; index < count; index++) {
                final int frameIndex = index;
                final JCheckBox box = new JCheckBox(Integer.toString(index + 1), true);
                box.setFocusable(false);
                box.addActionListener(new ActionListener() {
                    @Override
                    public void actionPerformed(ActionEvent e) {
                        if (!updating) {
                            session.toggleFrameEnabled(frameIndex);
                        }
                    }
                });
                frameBoxes.add(box);
                framePanel.add(box);
            }
            framePanel.revalidate();
            framePanel.repaint();
        }
        for (int index = 0; index < count; index++) {
            frameBoxes.get(index).setSelected(!event.isFrameDisabled(index));
        }
    }

    protected void openLink() {
        if (errorLink == null || !Desktop.isDesktopSupported()) {
            return;
        }
        try {
            Desktop.getDesktop().browse(new URI(errorLink));
        } catch (IOException | URISyntaxException ex) {
            LOG.warn("cannot open " + errorLink, ex);
        }
    }

    /**
     * Stop listening for events. Call when the panel is thrown away.
     */
    public void dispose() {
        eventBus.unregister(this);
    }

    private static String escape(String text) {
        return text == null ? "" : text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
