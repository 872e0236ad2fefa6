package ai.attackframework.tools.logwindow.ui;

import ai.attackframework.tools.logwindow.log.BoundedLogBuffer;
import ai.attackframework.tools.logwindow.log.Level;
import ai.attackframework.tools.logwindow.log.LogRecord;
import ai.attackframework.tools.logwindow.log.LogRecordFormatter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import javax.swing.event.TableModelEvent;
import java.awt.Color;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static ai.attackframework.tools.logwindow.ui.LogPanelTestHarness.flushEdt;
import static ai.attackframework.tools.logwindow.ui.LogPanelTestHarness.onEdt;
import static ai.attackframework.tools.logwindow.ui.LogPanelTestHarness.waitFor;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Table model behavior: filtering, pausing, eviction and reset, with records produced off the EDT.
 */
class LogTableModelHeadlessTest {

    private static final LocalDateTime TS = LocalDateTime.of(2024, 1, 2, 3, 4, 5);
    private static final LogRecordFormatter FMT = new LogRecordFormatter("HH:mm:ss");

    private LogTableModel model;

    @AfterEach
    void tearDown() {
        if (model != null) onEdt(model::dispose);
    }

    private static LogRecord rec(Level level, String msg) {
        return FMT.record(TS, level, msg);
    }

    private LogTableModel newModel(BoundedLogBuffer buffer, Level threshold) {
        model = onEdt(() -> new LogTableModel(buffer, threshold, FMT));
        return model;
    }

    private static void appendOffEdt(BoundedLogBuffer buffer, LogRecord... records) throws InterruptedException {
        Thread producer = new Thread(() -> {
            for (LogRecord r : records) buffer.append(r);
        }, "producer");
        producer.start();
        producer.join();
    }

    private List<String> messages() {
        return onEdt(() -> model.visibleRecords().stream().map(LogRecord::message).toList());
    }

    @Test
    void rows_follow_buffer_and_threshold() throws Exception {
        BoundedLogBuffer buffer = new BoundedLogBuffer(10);
        newModel(buffer, Level.WARN);

        appendOffEdt(buffer, rec(Level.INFO, "i"), rec(Level.WARN, "w"), rec(Level.ERROR, "e"), rec(Level.DEBUG, "d"));

        assertThat(waitFor(() -> model.getRowCount() == 2, 2000)).isTrue();
        assertThat(messages()).containsExactly("w", "e");
        assertThat(onEdt(model::totalCount)).isEqualTo(4);

        onEdt(() -> model.setThreshold(Level.TRACE));
        assertThat(messages()).containsExactly("i", "w", "e", "d");
        assertThat(onEdt(model::threshold)).isEqualTo(Level.TRACE);
    }

    @Test
    void columns_show_time_level_and_message() throws Exception {
        BoundedLogBuffer buffer = new BoundedLogBuffer(10);
        newModel(buffer, Level.TRACE);
        appendOffEdt(buffer, rec(Level.ERROR, "broken"));
        waitFor(() -> model.getRowCount() == 1, 2000);

        assertThat(onEdt(() -> model.getColumnName(LogTableModel.COL_TIME))).isEqualTo("Time");
        assertThat(onEdt(() -> model.getValueAt(0, LogTableModel.COL_TIME))).isEqualTo("03:04:05");
        assertThat(onEdt(() -> model.getValueAt(0, LogTableModel.COL_LEVEL))).isEqualTo("ERROR");
        assertThat(onEdt(() -> model.getValueAt(0, LogTableModel.COL_MESSAGE))).isEqualTo("broken");
        assertThat(onEdt(() -> model.getValueAt(5, LogTableModel.COL_MESSAGE))).isNull();
    }

    @Test
    void pause_freezes_rows_and_resume_catches_up() throws Exception {
        BoundedLogBuffer buffer = new BoundedLogBuffer(10);
        newModel(buffer, Level.INFO);
        appendOffEdt(buffer, rec(Level.INFO, "before"));
        waitFor(() -> model.getRowCount() == 1, 2000);

        onEdt(() -> model.setPaused(true));
        appendOffEdt(buffer, rec(Level.INFO, "while-paused"));
        flushEdt();
        flushEdt();
        assertThat(messages()).containsExactly("before");
        assertThat(onEdt(model::isPaused)).isTrue();

        // threshold still applies to the frozen rows
        onEdt(() -> model.setThreshold(Level.WARN));
        assertThat(messages()).isEmpty();
        onEdt(() -> model.setThreshold(Level.INFO));
        assertThat(messages()).containsExactly("before");

        onEdt(() -> model.setPaused(false));
        assertThat(messages()).containsExactly("before", "while-paused");
    }

    @Test
    void eviction_updates_rows_without_changing_count() throws Exception {
        BoundedLogBuffer buffer = new BoundedLogBuffer(3);
        newModel(buffer, Level.TRACE);
        appendOffEdt(buffer, rec(Level.INFO, "1"), rec(Level.INFO, "2"), rec(Level.INFO, "3"));
        waitFor(() -> model.getRowCount() == 3, 2000);

        List<Integer> types = new CopyOnWriteArrayList<>();
        onEdt(() -> model.addTableModelListener(e -> types.add(e.getType())));

        appendOffEdt(buffer, rec(Level.INFO, "4"));
        assertThat(waitFor(() -> "4".equals(model.recordAt(2).message()), 2000)).isTrue();

        assertThat(messages()).containsExactly("2", "3", "4");
        assertThat(types).contains(TableModelEvent.UPDATE).doesNotContain(TableModelEvent.DELETE);
    }

    @Test
    void clear_resets_rows() throws Exception {
        BoundedLogBuffer buffer = new BoundedLogBuffer(5);
        newModel(buffer, Level.TRACE);
        appendOffEdt(buffer, rec(Level.INFO, "a"), rec(Level.INFO, "b"));
        waitFor(() -> model.getRowCount() == 2, 2000);

        buffer.clear();

        assertThat(waitFor(() -> model.getRowCount() == 0, 2000)).isTrue();
        appendOffEdt(buffer, rec(Level.INFO, "fresh"));
        assertThat(waitFor(() -> model.getRowCount() == 1, 2000)).isTrue();
        assertThat(messages()).containsExactly("fresh");
    }

    @Test
    void disposed_model_stops_following_until_attached() throws Exception {
        BoundedLogBuffer buffer = new BoundedLogBuffer(5);
        newModel(buffer, Level.TRACE);
        onEdt(model::dispose);

        appendOffEdt(buffer, rec(Level.INFO, "unseen"));
        flushEdt();
        assertThat(onEdt(model::getRowCount)).isZero();

        onEdt(model::attach);
        assertThat(messages()).containsExactly("unseen");
    }

    @Test
    void background_colors_by_level() {
        assertThat(LogTableModel.backgroundFor(Level.WARN)).isEqualTo(new Color(255, 255, 128));
        assertThat(LogTableModel.backgroundFor(Level.ERROR)).isEqualTo(new Color(255, 128, 128));
        assertThat(LogTableModel.backgroundFor(Level.FATAL)).isEqualTo(new Color(255, 0, 0));
        assertThat(LogTableModel.backgroundFor(Level.INFO)).isNull();
        assertThat(LogTableModel.backgroundFor(null)).isNull();
    }
}
