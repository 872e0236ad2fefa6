package ai.attackframework.tools.logwindow.ui;

import ai.attackframework.tools.logwindow.log.Level;
import ai.attackframework.tools.logwindow.log.LogExport;
import ai.attackframework.tools.logwindow.log.LogRecord;
import ai.attackframework.tools.logwindow.log.WindowDestination;
import ai.attackframework.tools.logwindow.utils.FileUtil;
import ai.attackframework.tools.logwindow.utils.Logger;
import ai.attackframework.tools.logwindow.utils.config.LogWindowConfig;
import net.miginfocom.swing.MigLayout;

import javax.swing.AbstractAction;
import javax.swing.BorderFactory;
import javax.swing.JButton;
import javax.swing.JCheckBox;
import javax.swing.JComboBox;
import javax.swing.JComponent;
import javax.swing.JFileChooser;
import javax.swing.JLabel;
import javax.swing.JPanel;
import javax.swing.JScrollPane;
import javax.swing.JSeparator;
import javax.swing.JTable;
import javax.swing.JToggleButton;
import javax.swing.KeyStroke;
import javax.swing.ListSelectionModel;
import javax.swing.ScrollPaneConstants;
import javax.swing.SwingConstants;
import javax.swing.UIManager;
import javax.swing.event.TableModelEvent;
import javax.swing.filechooser.FileNameExtensionFilter;
import java.awt.BorderLayout;
import java.awt.Dimension;
import java.awt.Toolkit;
import java.awt.datatransfer.StringSelection;
import java.awt.event.ActionEvent;
import java.awt.event.InputEvent;
import java.awt.event.KeyEvent;
import java.io.File;
import java.io.IOException;
import java.io.Serial;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.prefs.Preferences;

/**
 * Log view with level filter, pause, auto-scroll, clear/copy/save.
 *
 * <p><strong>Design:</strong> Coordinates a {@link WindowDestination} (producer side) with a
 * {@link LogTableModel} (view side). Copy and save act on the selected rows, or on every visible
 * row when nothing is selected.</p>
 *
 * <p><strong>Threading:</strong> construct and use on the EDT. Buffer changes reach the table
 * through the model, which marshals them with {@code invokeLater}.</p>
 */
public class LogPanel extends JPanel {

    @Serial
    private static final long serialVersionUID = 1L;

    // Toolbar layout snippets
    private static final String MIG_TOOLBAR_INSETS = "insets 6 8 6 8, fillx, novisualpadding, gapx 6";
    private static final String MIG_SEP            = "h 18!, gapx 8";
    private static final String GAP4               = "gapx 4";
    private static final String GAP8               = "gapx 8";

    // Actions
    private static final String ACTION_COPY = "log.copy";

    // Persistence
    static final Preferences PREFS = Preferences.userRoot().node("ai/attackframework/tools/logwindow/ui/LogPanel");
    static final String PREF_MIN_LEVEL   = "minLevel";
    static final String PREF_AUTO_SCROLL = "autoScroll";

    private final transient WindowDestination destination;
    private final transient Preferences prefs;
    private final transient LogTableModel model;
    private final String saveBaseName;

    // Controls
    private final JTable table;
    private final JComboBox<Level> levelCombo;
    private final JToggleButton pauseButton;
    private final JCheckBox autoScroll;
    private final JLabel countLabel;

    private int lastScrolledRow = -1;

    /** Constructs the panel with the shared preferences node (EDT). */
    public LogPanel(WindowDestination destination, LogWindowConfig config) {
        this(destination, config, PREFS);
    }

    /**
     * Constructs and wires the UI (EDT).
     *
     * <p>
     * @param destination record source (required)
     * @param config      initial settings; persisted preferences win (required)
     * @param prefs       node for persisted UI state (required)
     */
    public LogPanel(WindowDestination destination, LogWindowConfig config, Preferences prefs) {
        this.destination = Objects.requireNonNull(destination, "destination");
        this.prefs = Objects.requireNonNull(prefs, "prefs");
        Objects.requireNonNull(config, "config");
        this.saveBaseName = config.title().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");

        setLayout(new BorderLayout());
        setPreferredSize(new Dimension(900, 400));

        Level initial = Level.fromString(prefs.get(PREF_MIN_LEVEL, config.minLevel().name()));
        if (initial == Level.OFF) initial = Level.FATAL;
        model = new LogTableModel(destination.buffer(), initial, destination.formatter());

        // Table
        table = new JTable(model);
        table.setName("log.table");
        table.setSelectionMode(ListSelectionModel.MULTIPLE_INTERVAL_SELECTION);
        table.setRowSelectionAllowed(true);
        table.setFillsViewportHeight(true);
        table.setDefaultRenderer(String.class, new LevelRowRenderer());
        table.getColumnModel().getColumn(LogTableModel.COL_TIME).setPreferredWidth(170);
        table.getColumnModel().getColumn(LogTableModel.COL_LEVEL).setPreferredWidth(60);
        table.getColumnModel().getColumn(LogTableModel.COL_MESSAGE).setPreferredWidth(650);

        // Toolbar
        JPanel toolbar = new JPanel(new MigLayout(MIG_TOOLBAR_INSETS, "", "[]"));
        toolbar.setBorder(BorderFactory.createMatteBorder(0, 0, 1, 0, UIManager.getColor("Separator.foreground")));

        levelCombo = new JComboBox<>(Level.selectable().toArray(new Level[0]));
        levelCombo.setName("log.filter.level");
        levelCombo.setSelectedItem(initial);

        pauseButton = new JToggleButton("Pause");
        pauseButton.setName("log.pause");
        pauseButton.setToolTipText("Freeze the view; new records are kept");

        autoScroll = new JCheckBox("Auto-scroll");
        autoScroll.setName("log.autoscroll");
        autoScroll.setSelected(prefs.getBoolean(PREF_AUTO_SCROLL, config.autoScroll()));

        JButton clearBtn = new JButton("Clear");
        clearBtn.setName("log.clear");
        clearBtn.setToolTipText("Clear all records");
        JButton copyBtn = new JButton("Copy");
        copyBtn.setName(ACTION_COPY);
        copyBtn.setToolTipText("Copy selected (or all visible) rows to clipboard");
        JButton saveBtn = new JButton("Save…");
        saveBtn.setName("log.save");
        saveBtn.setToolTipText("Save selected (or all visible) rows to file");

        countLabel = new JLabel("0/0");
        countLabel.setName("log.count");

        toolbar.add(new JLabel("Level:"));
        toolbar.add(levelCombo, "w 110!");
        toolbar.add(new JSeparator(SwingConstants.VERTICAL), MIG_SEP);
        toolbar.add(pauseButton);
        toolbar.add(autoScroll, GAP8);

        toolbar.add(new JLabel(), "pushx, growx");

        toolbar.add(countLabel);
        toolbar.add(new JSeparator(SwingConstants.VERTICAL), MIG_SEP);
        toolbar.add(clearBtn, GAP8);
        toolbar.add(copyBtn, GAP4);
        toolbar.add(saveBtn, GAP4);

        add(toolbar, BorderLayout.NORTH);

        JScrollPane scrollPane = new JScrollPane(
                table,
                ScrollPaneConstants.VERTICAL_SCROLLBAR_AS_NEEDED,
                ScrollPaneConstants.HORIZONTAL_SCROLLBAR_AS_NEEDED
        );
        add(scrollPane, BorderLayout.CENTER);

        // Wiring
        levelCombo.addActionListener(e -> {
            Level lvl = (Level) levelCombo.getSelectedItem();
            if (lvl == null) return;
            prefs.put(PREF_MIN_LEVEL, lvl.name());
            model.setThreshold(lvl);
        });

        pauseButton.addActionListener(e -> {
            boolean paused = pauseButton.isSelected();
            pauseButton.setText(paused ? "Resume" : "Pause");
            model.setPaused(paused);
        });

        autoScroll.addActionListener(e -> {
            prefs.putBoolean(PREF_AUTO_SCROLL, autoScroll.isSelected());
            if (autoScroll.isSelected()) scrollToBottom();
        });

        clearBtn.addActionListener(e -> {
            Logger.internalDebug("LogPanel: clear requested");
            destination.clear();
        });
        copyBtn.addActionListener(e -> copySelection());
        saveBtn.addActionListener(e -> saveSelection());

        table.getInputMap(JComponent.WHEN_FOCUSED).put(
                KeyStroke.getKeyStroke(KeyEvent.VK_C, InputEvent.CTRL_DOWN_MASK), ACTION_COPY
        );
        table.getActionMap().put(ACTION_COPY, new AbstractAction() {
            @Override public void actionPerformed(ActionEvent e) { copySelection(); }
        });

        model.addTableModelListener(e -> {
            updateCount();
            if (autoScroll.isSelected() && bringsNewLastRow(e)) scrollToBottom();
        });

        updateCount();
    }

    @Override
    public void addNotify() {
        super.addNotify();
        model.attach();
    }

    @Override
    public void removeNotify() {
        super.removeNotify();
        model.dispose();
    }

    // ---- Selection text ----

    /**
     * Text of the selected rows in display order, or of every visible row when nothing is
     * selected.
     */
    String selectionText() {
        return LogExport.toText(selectedOrVisibleRecords());
    }

    private List<LogRecord> selectedOrVisibleRecords() {
        int[] selected = table.getSelectedRows();
        if (selected.length == 0) return model.visibleRecords();

        int[] modelRows = new int[selected.length];
        for (int i = 0; i < selected.length; i++) {
            modelRows[i] = table.convertRowIndexToModel(selected[i]);
        }
        Arrays.sort(modelRows);
        List<LogRecord> out = new ArrayList<>(modelRows.length);
        for (int r : modelRows) {
            if (r >= 0 && r < model.getRowCount()) out.add(model.recordAt(r));
        }
        return out;
    }

    // ---- Copy/Save ----

    private void copySelection() {
        String text = selectionText();
        if (text.isEmpty()) return;
        try {
            Toolkit.getDefaultToolkit()
                    .getSystemClipboard()
                    .setContents(new StringSelection(text), null);
        } catch (RuntimeException ex) {
            Logger.internalDebug("LogPanel copy failed: " + ex);
        }
    }

    private void saveSelection() {
        if (selectionText().isEmpty()) return;

        JFileChooser chooser = new JFileChooser();
        chooser.setDialogTitle("Save log");
        chooser.setFileFilter(new FileNameExtensionFilter("Log file (*.log)", "log"));
        String ts = java.time.format.DateTimeFormatter
                .ofPattern("yyyyMMdd-HHmmss")
                .format(java.time.LocalDateTime.now());
        chooser.setSelectedFile(new File(saveBaseName + "-" + ts + FileUtil.LOG_EXTENSION));
        if (chooser.showSaveDialog(this) != JFileChooser.APPROVE_OPTION) return;

        saveTo(FileUtil.ensureLogExtension(chooser.getSelectedFile()).toPath());
    }

    /**
     * Writes {@link #selectionText()} to {@code out}.
     *
     * <p>
     * @param out destination file
     * @return {@code true} when something was written
     */
    boolean saveTo(Path out) {
        String text = selectionText();
        if (text.isEmpty()) return false;
        try {
            FileUtil.writeStringCreateDirs(out, text);
            Logger.internalDebug("LogPanel saved " + text.length() + " chars to " + out);
            return true;
        } catch (IOException ex) {
            Logger.logError("Save failed: " + ex.getMessage());
            return false;
        }
    }

    // ---- View helpers ----

    private void scrollToBottom() {
        int last = table.getRowCount() - 1;
        if (last < 0) return;
        table.scrollRectToVisible(table.getCellRect(last, 0, true));
        lastScrolledRow = last;
    }

    // At capacity an append shifts every row and fires an update ending on the last row.
    private boolean bringsNewLastRow(TableModelEvent e) {
        if (e.getType() == TableModelEvent.INSERT) return true;
        return e.getType() == TableModelEvent.UPDATE
                && e.getLastRow() != Integer.MAX_VALUE
                && e.getLastRow() == model.getRowCount() - 1;
    }

    private void updateCount() {
        countLabel.setText(model.getRowCount() + "/" + model.totalCount());
    }

    /** Row most recently scrolled into view by auto-scroll; -1 before the first scroll. */
    int lastScrolledRow() { return lastScrolledRow; }

    LogTableModel model() { return model; }

    JTable table() { return table; }
}
