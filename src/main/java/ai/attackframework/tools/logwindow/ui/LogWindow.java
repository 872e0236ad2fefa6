package ai.attackframework.tools.logwindow.ui;

import ai.attackframework.tools.logwindow.log.WindowDestination;
import ai.attackframework.tools.logwindow.utils.config.LogWindowConfig;

import javax.swing.JDialog;
import javax.swing.WindowConstants;
import java.awt.Window;
import java.io.Serial;

/**
 * Non-modal dialog hosting a {@link LogPanel}. Closing hides the dialog; the panel keeps
 * following the destination until the dialog is disposed.
 */
public class LogWindow extends JDialog {

    @Serial
    private static final long serialVersionUID = 1L;

    private final LogPanel panel;

    /**
     * Builds the dialog (EDT).
     *
     * <p>
     * @param owner       owner window (nullable)
     * @param destination record source
     * @param config      window settings
     */
    public LogWindow(Window owner, WindowDestination destination, LogWindowConfig config) {
        super(owner, config.title(), ModalityType.MODELESS);
        setDefaultCloseOperation(WindowConstants.HIDE_ON_CLOSE);
        panel = new LogPanel(destination, config);
        setContentPane(panel);
        pack();
        setLocationRelativeTo(owner);
    }

    public LogPanel panel() { return panel; }
}
