package io.herald.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.herald.cli.CliContext;
import io.herald.cli.HeraldCliCommand;
import io.herald.cli.HeraldRuntime;
import io.herald.cli.NextRunCommand;
import io.herald.cli.OnboardCommand;
import io.herald.cli.RunCommand;
import io.herald.cli.StatusCommand;
import io.herald.cli.TriggerCommand;
import io.herald.core.config.ConfigPaths;
import io.herald.core.config.ConfigService;
import io.herald.core.config.model.HeraldConfig;
import io.herald.core.config.model.StorageSettings;
import io.herald.core.content.FileContentSource;
import io.herald.core.content.SectionedContentResolver;
import io.herald.core.delivery.ChannelRegistry;
import io.herald.core.delivery.DeliveryManager;
import io.herald.core.delivery.channel.DiscordChannel;
import io.herald.core.delivery.channel.EmailChannel;
import io.herald.core.delivery.channel.InAppChannel;
import io.herald.core.delivery.channel.SlackChannel;
import io.herald.core.delivery.channel.SmtpMailSender;
import io.herald.core.delivery.channel.TelegramChannel;
import io.herald.core.delivery.channel.WebhookChannel;
import io.herald.core.model.Delivery;
import io.herald.core.model.Schedule;
import io.herald.core.scheduler.NewsletterScheduler;
import io.herald.core.scheduler.ScheduleRunner;
import io.herald.core.store.InMemoryNewsletterStore;
import io.herald.core.store.SqliteNewsletterStore;
import io.herald.core.template.QuteTemplateRenderer;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class HeraldApplication {
    private static final Logger LOG = LoggerFactory.getLogger(HeraldApplication.class);

    private HeraldApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        HeraldConfig config = loadConfig(configService, configPath);

        CliContext context = new CliContext(configService, configPath, new LazyRuntime(config));

        CommandLine commandLine = new CommandLine(new HeraldCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("run", new RunCommand(context));
        commandLine.addSubcommand("next-run", new NextRunCommand());
        commandLine.addSubcommand("trigger", new TriggerCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static HeraldConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
            return HeraldConfig.defaults();
        }
    }

    /**
     * Opens the store and wires channels only when a command first needs them.
     */
    private static final class LazyRuntime implements HeraldRuntime {
        private final HeraldConfig config;
        private Engine engine;

        LazyRuntime(HeraldConfig config) {
            this.config = config;
        }

        @Override
        public int runScheduler() throws Exception {
            Engine wired = engine();
            CountDownLatch shutdown = new CountDownLatch(1);
            try (NewsletterScheduler scheduler = wired.scheduler()) {
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    scheduler.stop();
                    shutdown.countDown();
                }));
                scheduler.start();
                System.out.println(
                    "Scheduler running with channels " + String.join(", ", wired.registry().names())
                        + "; press Ctrl+C to stop"
                );
                shutdown.await();
            }
            return 0;
        }

        @Override
        public Delivery trigger(String scheduleId) throws Exception {
            try (NewsletterScheduler scheduler = engine().scheduler()) {
                return scheduler.trigger(scheduleId);
            }
        }

        @Override
        public List<Schedule> schedules() throws Exception {
            return engine().store().schedules().list();
        }

        @Override
        public List<String> channels() {
            try {
                return engine().registry().names();
            } catch (IOException e) {
                throw new IllegalStateException("Failed to initialize newsletter store", e);
            }
        }

        private synchronized Engine engine() throws IOException {
            if (engine == null) {
                engine = Engine.wire(config);
            }
            return engine;
        }
    }

    private record Engine(StoreHandle store, ChannelRegistry registry, ScheduleRunner runner, HeraldConfig config) {

        static Engine wire(HeraldConfig config) throws IOException {
            Clock clock = Clock.systemUTC();
            StoreHandle store = buildStore(config);

            ObjectMapper mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            Duration httpTimeout = config.delivery().httpTimeout();
            OkHttpClient httpClient = new OkHttpClient.Builder()
                .connectTimeout(httpTimeout)
                .readTimeout(httpTimeout)
                .writeTimeout(httpTimeout)
                .callTimeout(httpTimeout)
                .build();

            ChannelRegistry registry = new ChannelRegistry();
            registry.register(new EmailChannel(new SmtpMailSender(httpTimeout)));
            registry.register(new DiscordChannel(httpClient, mapper));
            registry.register(new SlackChannel(httpClient, mapper));
            registry.register(new TelegramChannel(httpClient, mapper));
            registry.register(new WebhookChannel(httpClient, mapper));
            registry.register(new InAppChannel(store.notifications(), clock));

            DeliveryManager deliveryManager = new DeliveryManager(registry, config.delivery().toManagerConfig(), clock);
            SectionedContentResolver contentResolver = new SectionedContentResolver(
                new FileContentSource(ConfigPaths.resolveContentDir(config), mapper),
                config.content().serverName(),
                config.content().serverUrl(),
                config.content().baseUrl(),
                clock
            );
            ScheduleRunner runner = new ScheduleRunner(
                store.schedules(),
                store.templates(),
                store.deliveries(),
                contentResolver,
                new QuteTemplateRenderer(),
                deliveryManager,
                config.content().serverName(),
                clock
            );
            return new Engine(store, registry, runner, config);
        }

        NewsletterScheduler scheduler() {
            return new NewsletterScheduler(store.schedules(), runner, config.scheduler().toOptions(), Clock.systemUTC());
        }

        private static StoreHandle buildStore(HeraldConfig config) throws IOException {
            String backend = System.getenv().getOrDefault("HERALD_STORE", config.storage().backend());
            backend = backend == null ? StorageSettings.BACKEND_SQLITE : backend.trim().toLowerCase(Locale.ROOT);
            if (StorageSettings.BACKEND_MEMORY.equals(backend)) {
                LOG.warn("Using in-memory store; schedules and delivery history are lost on exit");
                return StoreHandle.of(new InMemoryNewsletterStore());
            }
            if (!StorageSettings.BACKEND_SQLITE.equals(backend)) {
                throw new IllegalArgumentException("unknown storage backend: " + backend);
            }
            Path sqlitePath = ConfigPaths.resolveSqlitePath(config);
            LOG.debug("Opening SQLite store at {}", sqlitePath);
            return StoreHandle.of(new SqliteNewsletterStore(sqlitePath));
        }
    }
}
