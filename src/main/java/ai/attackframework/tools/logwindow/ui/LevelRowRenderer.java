package ai.attackframework.tools.logwindow.ui;

import javax.swing.JTable;
import javax.swing.table.DefaultTableCellRenderer;
import java.awt.Color;
import java.awt.Component;
import java.io.Serial;

/**
 * Cell renderer that tints unselected rows by level ({@link LogTableModel#backgroundFor}).
 */
final class LevelRowRenderer extends DefaultTableCellRenderer {

    @Serial
    private static final long serialVersionUID = 1L;

    @Override
    public Component getTableCellRendererComponent(JTable table, Object value, boolean isSelected,
                                                   boolean hasFocus, int row, int column) {
        Component c = super.getTableCellRendererComponent(table, value, isSelected, hasFocus, row, column);
        if (isSelected) return c;

        Color bg = null;
        if (table.getModel() instanceof LogTableModel model) {
            int modelRow = table.convertRowIndexToModel(row);
            if (modelRow >= 0 && modelRow < model.getRowCount()) {
                bg = LogTableModel.backgroundFor(model.recordAt(modelRow).level());
            }
        }
        c.setBackground(bg != null ? bg : table.getBackground());
        c.setForeground(table.getForeground());
        return c;
    }
}
