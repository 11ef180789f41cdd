package io.herald.core.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.herald.core.delivery.channel.InAppNotification;
import io.herald.core.delivery.channel.InAppNotificationStore;
import io.herald.core.model.Delivery;
import io.herald.core.model.DeliveryStatus;
import io.herald.core.model.NewsletterTemplate;
import io.herald.core.model.Schedule;
import io.herald.core.scheduler.DeliveryRepository;
import io.herald.core.scheduler.ScheduleRepository;
import io.herald.core.scheduler.TemplateRepository;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SQLite-backed store. Scheduling columns (enabled flag, fire times, counters) are real columns so the due query
 * and counter updates run in SQL; the rest of each record is kept as JSON.
 */
public final class SqliteNewsletterStore
    implements ScheduleRepository, TemplateRepository, DeliveryRepository, InAppNotificationStore {

    private static final String SCHEDULE_COLUMNS = """
        definition_json, enabled, last_run_at, next_run_at, last_run_status, run_count, success_count, failure_count
        """;

    private final String jdbcUrl;
    private final ObjectMapper mapper;

    public SqliteNewsletterStore(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        init();
    }

    @Override
    public synchronized List<Schedule> findDue(Instant now) throws IOException {
        String sql = "SELECT " + SCHEDULE_COLUMNS + """
            FROM schedules
            WHERE enabled = 1 AND next_run_at IS NOT NULL AND next_run_at <= ?
            ORDER BY next_run_at ASC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, now.toEpochMilli());
            return readSchedules(statement);
        } catch (SQLException e) {
            throw new IOException("Failed to query due schedules", e);
        }
    }

    @Override
    public synchronized Optional<Schedule> findById(String id) throws IOException {
        String sql = "SELECT " + SCHEDULE_COLUMNS + "FROM schedules WHERE id = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, id);
            return readSchedules(statement).stream().findFirst();
        } catch (SQLException e) {
            throw new IOException("Failed to load schedule " + id, e);
        }
    }

    @Override
    public synchronized List<Schedule> list() throws IOException {
        String sql = "SELECT " + SCHEDULE_COLUMNS + "FROM schedules ORDER BY name ASC";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            return readSchedules(statement);
        } catch (SQLException e) {
            throw new IOException("Failed to list schedules", e);
        }
    }

    @Override
    public synchronized void save(Schedule schedule) throws IOException {
        String sql = """
            INSERT INTO schedules (id, name, definition_json, enabled, last_run_at, next_run_at, last_run_status,
                                   run_count, success_count, failure_count)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET
                name = excluded.name,
                definition_json = excluded.definition_json,
                enabled = excluded.enabled,
                last_run_at = excluded.last_run_at,
                next_run_at = excluded.next_run_at,
                last_run_status = excluded.last_run_status,
                run_count = excluded.run_count,
                success_count = excluded.success_count,
                failure_count = excluded.failure_count
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, schedule.id());
            statement.setString(2, safe(schedule.name()));
            statement.setString(3, mapper.writeValueAsString(schedule));
            statement.setInt(4, schedule.enabled() ? 1 : 0);
            setInstant(statement, 5, schedule.lastRunAt());
            setInstant(statement, 6, schedule.nextRunAt());
            statement.setString(7, schedule.lastRunStatus() == null ? null : schedule.lastRunStatus().wireName());
            statement.setInt(8, schedule.runCount());
            statement.setInt(9, schedule.successCount());
            statement.setInt(10, schedule.failureCount());
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to save schedule " + schedule.id(), e);
        }
    }

    @Override
    public synchronized void updateRunStatus(String id, DeliveryStatus status, Instant lastRunAt, Instant nextRunAt)
        throws IOException {
        String sql = """
            UPDATE schedules
            SET last_run_at = ?,
                next_run_at = ?,
                last_run_status = ?,
                run_count = run_count + 1,
                success_count = success_count + ?,
                failure_count = failure_count + ?
            WHERE id = ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            setInstant(statement, 1, lastRunAt);
            setInstant(statement, 2, nextRunAt);
            statement.setString(3, status.wireName());
            statement.setInt(4, status == DeliveryStatus.DELIVERED ? 1 : 0);
            statement.setInt(5, status == DeliveryStatus.FAILED ? 1 : 0);
            statement.setString(6, id);
            if (statement.executeUpdate() == 0) {
                throw new IOException("schedule not found: " + id);
            }
        } catch (SQLException e) {
            throw new IOException("Failed to update run status of schedule " + id, e);
        }
    }

    @Override
    public synchronized Optional<NewsletterTemplate> findTemplate(String id) throws IOException {
        String sql = "SELECT template_json FROM templates WHERE id = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, id);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapper.readValue(resultSet.getString("template_json"), NewsletterTemplate.class));
            }
        } catch (SQLException e) {
            throw new IOException("Failed to load template " + id, e);
        }
    }

    @Override
    public synchronized void saveTemplate(NewsletterTemplate template) throws IOException {
        String sql = """
            INSERT INTO templates (id, name, version, template_json)
            VALUES (?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET
                name = excluded.name,
                version = excluded.version,
                template_json = excluded.template_json
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, template.id());
            statement.setString(2, safe(template.name()));
            statement.setInt(3, template.version());
            statement.setString(4, mapper.writeValueAsString(template));
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to save template " + template.id(), e);
        }
    }

    @Override
    public synchronized void createDelivery(Delivery delivery) throws IOException {
        String sql = """
            INSERT INTO deliveries (id, schedule_id, status, started_at, delivery_json)
            VALUES (?, ?, ?, ?, ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            bindDelivery(statement, delivery, 1, 2, 3, 4, 5);
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to create delivery " + delivery.id(), e);
        }
    }

    @Override
    public synchronized void updateDelivery(Delivery delivery) throws IOException {
        String sql = """
            UPDATE deliveries
            SET schedule_id = ?, status = ?, started_at = ?, delivery_json = ?
            WHERE id = ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            bindDelivery(statement, delivery, 5, 1, 2, 3, 4);
            if (statement.executeUpdate() == 0) {
                throw new IOException("delivery not found: " + delivery.id());
            }
        } catch (SQLException e) {
            throw new IOException("Failed to update delivery " + delivery.id(), e);
        }
    }

    @Override
    public synchronized Optional<Delivery> findDelivery(String id) throws IOException {
        String sql = "SELECT delivery_json FROM deliveries WHERE id = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, id);
            return readDeliveries(statement).stream().findFirst();
        } catch (SQLException e) {
            throw new IOException("Failed to load delivery " + id, e);
        }
    }

    @Override
    public synchronized List<Delivery> listDeliveries(String scheduleId, int limit) throws IOException {
        String sql = """
            SELECT delivery_json
            FROM deliveries
            WHERE (? IS NULL OR schedule_id = ?)
            ORDER BY started_at DESC
            LIMIT ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, scheduleId);
            statement.setString(2, scheduleId);
            statement.setInt(3, limit > 0 ? limit : -1);
            return readDeliveries(statement);
        } catch (SQLException e) {
            throw new IOException("Failed to list deliveries", e);
        }
    }

    @Override
    public synchronized void save(InAppNotification notification) throws IOException {
        String sql = """
            INSERT INTO in_app_notifications (id, user_id, created_at, notification_json)
            VALUES (?, ?, ?, ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, notification.id());
            statement.setString(2, notification.userId());
            setInstant(statement, 3, notification.createdAt());
            statement.setString(4, mapper.writeValueAsString(notification));
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to save notification for user " + notification.userId(), e);
        }
    }

    @Override
    public synchronized List<InAppNotification> listForUser(String userId) throws IOException {
        String sql = """
            SELECT notification_json
            FROM in_app_notifications
            WHERE user_id = ?
            ORDER BY created_at ASC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, userId);
            List<InAppNotification> notifications = new ArrayList<>();
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    notifications.add(mapper.readValue(resultSet.getString("notification_json"), InAppNotification.class));
                }
            }
            return notifications;
        } catch (SQLException e) {
            throw new IOException("Failed to list notifications for user " + userId, e);
        }
    }

    private List<Schedule> readSchedules(PreparedStatement statement) throws SQLException, IOException {
        List<Schedule> schedules = new ArrayList<>();
        try (ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                Schedule stored = mapper.readValue(resultSet.getString("definition_json"), Schedule.class);
                String status = resultSet.getString("last_run_status");
                schedules.add(new Schedule(
                    stored.id(),
                    stored.name(),
                    stored.templateId(),
                    stored.recipients(),
                    stored.cronExpression(),
                    stored.timezone(),
                    stored.configOverrides(),
                    stored.channels(),
                    stored.channelConfigs(),
                    resultSet.getInt("enabled") == 1,
                    getInstant(resultSet, "last_run_at"),
                    getInstant(resultSet, "next_run_at"),
                    status == null ? null : DeliveryStatus.fromWireName(status),
                    resultSet.getInt("run_count"),
                    resultSet.getInt("success_count"),
                    resultSet.getInt("failure_count")
                ));
            }
        }
        return schedules;
    }

    private List<Delivery> readDeliveries(PreparedStatement statement) throws SQLException, IOException {
        List<Delivery> deliveries = new ArrayList<>();
        try (ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                deliveries.add(mapper.readValue(resultSet.getString("delivery_json"), Delivery.class));
            }
        }
        return deliveries;
    }

    private void bindDelivery(
        PreparedStatement statement,
        Delivery delivery,
        int idIndex,
        int scheduleIndex,
        int statusIndex,
        int startedIndex,
        int jsonIndex
    ) throws SQLException, IOException {
        statement.setString(idIndex, delivery.id());
        statement.setString(scheduleIndex, delivery.scheduleId());
        statement.setString(statusIndex, delivery.status().wireName());
        setInstant(statement, startedIndex, delivery.startedAt());
        statement.setString(jsonIndex, mapper.writeValueAsString(delivery));
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        }
        return connection;
    }

    private void init() throws IOException {
        String schedules = """
            CREATE TABLE IF NOT EXISTS schedules (
                id TEXT PRIMARY KEY,
                name TEXT NOT NULL,
                definition_json TEXT NOT NULL,
                enabled INTEGER NOT NULL,
                last_run_at INTEGER,
                next_run_at INTEGER,
                last_run_status TEXT,
                run_count INTEGER NOT NULL DEFAULT 0,
                success_count INTEGER NOT NULL DEFAULT 0,
                failure_count INTEGER NOT NULL DEFAULT 0
            )
            """;
        String dueIndex = """
            CREATE INDEX IF NOT EXISTS idx_schedules_due
            ON schedules(enabled, next_run_at)
            """;
        String templates = """
            CREATE TABLE IF NOT EXISTS templates (
                id TEXT PRIMARY KEY,
                name TEXT NOT NULL,
                version INTEGER NOT NULL,
                template_json TEXT NOT NULL
            )
            """;
        String deliveries = """
            CREATE TABLE IF NOT EXISTS deliveries (
                id TEXT PRIMARY KEY,
                schedule_id TEXT NOT NULL,
                status TEXT NOT NULL,
                started_at INTEGER,
                delivery_json TEXT NOT NULL
            )
            """;
        String deliveriesIndex = """
            CREATE INDEX IF NOT EXISTS idx_deliveries_schedule
            ON deliveries(schedule_id, started_at DESC)
            """;
        String notifications = """
            CREATE TABLE IF NOT EXISTS in_app_notifications (
                id TEXT PRIMARY KEY,
                user_id TEXT NOT NULL,
                created_at INTEGER,
                notification_json TEXT NOT NULL
            )
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(schedules);
            statement.execute(dueIndex);
            statement.execute(templates);
            statement.execute(deliveries);
            statement.execute(deliveriesIndex);
            statement.execute(notifications);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite newsletter store", e);
        }
    }

    private static void setInstant(PreparedStatement statement, int index, Instant value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setLong(index, value.toEpochMilli());
        }
    }

    private static Instant getInstant(ResultSet resultSet, String column) throws SQLException {
        long millis = resultSet.getLong(column);
        return resultSet.wasNull() ? null : Instant.ofEpochMilli(millis);
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
