package com.disasteralert.service;

import com.disasteralert.core.bus.EventBus;
import com.disasteralert.core.events.Event;
import com.disasteralert.core.model.EventKey;
import com.disasteralert.core.model.Report;
import com.disasteralert.core.model.Subscription;
import com.disasteralert.engine.api.AlertTransport;
import com.disasteralert.engine.api.DispatchContext;
import com.disasteralert.engine.dispatch.DeliveryResult;
import com.disasteralert.engine.dispatch.DispatchFailedException;
import com.disasteralert.engine.dispatch.DispatchOrchestrator;
import com.disasteralert.engine.dispatch.DispatchReport;
import com.disasteralert.engine.dispatch.GroupResult;
import com.disasteralert.engine.grouping.EventGrouper;
import com.disasteralert.engine.grouping.LocationNormalizer;
import com.disasteralert.service.config.AlertingConfig;
import com.disasteralert.service.config.ConfigLoader;
import com.disasteralert.service.email.DevOutboxEmailSender;
import com.disasteralert.service.email.SmtpEmailSender;
import com.disasteralert.service.intake.ReportLoader;
import com.disasteralert.service.store.JsonFileSubscriptionStore;
import com.disasteralert.service.store.JsonlAlertLog;
import com.disasteralert.service.store.JsonlEventStore;
import com.disasteralert.service.store.JsonlReportArchive;
import com.disasteralert.service.store.SubscriptionRegistry;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    private static final String USAGE = """
            Usage: disaster-alert <command> [options]
            Commands:
              init                        create the data files
              add <location> <email>      subscribe an address to a location
              remove <location> <email>   unsubscribe an address from a location
              list                        show all subscriptions
              dispatch <reports.json>     group reports and send alerts
              history [limit]             show recent dispatch events""";

    private Main() {
    }

    public static void main(String[] args) {
        int status = run(Arrays.asList(args), System.getenv(), Clock.systemUTC(), System.out);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(List<String> args, Map<String, String> env, Clock clock, PrintStream out) {
        if (args.isEmpty()) {
            out.println(USAGE);
            return 2;
        }
        Paths paths = Paths.from(env);
        AlertingConfig config = ConfigLoader.loadAlerting(paths.configDir());
        LocationNormalizer normalizer = new LocationNormalizer(config.locationAliases());
        String command = args.get(0);

        switch (command) {
            case "init":
                if (args.size() != 1) {
                    break;
                }
                return init(paths, out);
            case "add":
                if (args.size() != 3) {
                    break;
                }
                return add(subscriptions(paths, normalizer), normalizer, args.get(1), args.get(2), out);
            case "remove":
                if (args.size() != 3) {
                    break;
                }
                return remove(subscriptions(paths, normalizer), normalizer, args.get(1), args.get(2), out);
            case "list":
                if (args.size() != 1) {
                    break;
                }
                return list(subscriptions(paths, normalizer), out);
            case "dispatch":
                if (args.size() != 2) {
                    break;
                }
                return dispatch(paths, config, normalizer, Path.of(args.get(1)), env, clock, out);
            case "history":
                if (args.size() > 2) {
                    break;
                }
                return history(paths, args.size() == 2 ? args.get(1) : "20", out);
            default:
                break;
        }
        out.println("Invalid command or arguments: " + String.join(" ", args));
        out.println(USAGE);
        return 2;
    }

    private static int init(Paths paths, PrintStream out) {
        try {
            Files.createDirectories(paths.dataDir());
            Files.createDirectories(paths.logDir());
            if (!Files.exists(paths.subscriptions())) {
                Files.writeString(paths.subscriptions(), "[]");
            }
            if (!Files.exists(paths.sentAlerts())) {
                Files.createFile(paths.sentAlerts());
            }
            if (!Files.exists(paths.reportArchive())) {
                Files.createFile(paths.reportArchive());
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed initializing data directory " + paths.dataDir(), e);
        }
        out.println("Initialized data files under " + paths.dataDir());
        return 0;
    }

    private static int add(
            SubscriptionRegistry registry,
            LocationNormalizer normalizer,
            String location,
            String email,
            PrintStream out
    ) {
        String canonical = normalizer.normalize(location);
        SubscriptionRegistry.AddResult result;
        try {
            result = registry.add(location, email);
        } catch (IllegalArgumentException e) {
            out.println("Cannot subscribe: " + e.getMessage());
            return 2;
        }
        if (result == SubscriptionRegistry.AddResult.ALREADY_EXISTS) {
            out.println("'" + email.trim() + "' is already subscribed to '" + canonical + "'.");
        } else {
            out.println("Added '" + email.trim() + "' to location '" + canonical + "'.");
        }
        return 0;
    }

    private static int remove(
            SubscriptionRegistry registry,
            LocationNormalizer normalizer,
            String location,
            String email,
            PrintStream out
    ) {
        String canonical = normalizer.normalize(location);
        boolean removed;
        try {
            removed = registry.remove(location, email);
        } catch (IllegalArgumentException e) {
            out.println("Cannot unsubscribe: " + e.getMessage());
            return 2;
        }
        if (removed) {
            out.println("Removed '" + email.trim() + "' from location '" + canonical + "'.");
        } else {
            out.println("No subscription found for '" + email.trim() + "' in '" + canonical + "'.");
        }
        return 0;
    }

    private static int list(SubscriptionRegistry registry, PrintStream out) {
        List<Subscription> all = registry.list();
        if (all.isEmpty()) {
            out.println("No subscriptions found.");
            return 0;
        }
        out.println("--- Current Subscriptions ---");
        for (Subscription subscription : all) {
            out.println("- Location: " + subscription.location() + ", User: " + subscription.email());
        }
        return 0;
    }

    private static int dispatch(
            Paths paths,
            AlertingConfig config,
            LocationNormalizer normalizer,
            Path reportsFile,
            Map<String, String> env,
            Clock clock,
            PrintStream out
    ) {
        List<Report> reports;
        AlertTransport transport;
        try {
            reports = ReportLoader.load(reportsFile);
            transport = transport(paths, env, clock);
        } catch (IllegalStateException | IllegalArgumentException e) {
            out.println("Cannot dispatch: " + e.getMessage());
            return 2;
        }
        new JsonlReportArchive(paths.reportArchive(), clock).archive(reports);
        Map<EventKey, List<Report>> groups = new EventGrouper(normalizer).group(reports);
        out.println("Loaded " + reports.size() + " report(s) forming " + groups.size() + " event(s).");

        EventBus eventBus = new EventBus();
        JsonlEventStore journal = new JsonlEventStore(paths.eventJournal());
        eventBus.subscribeAll(journal::append);

        ExecutorService groupExecutor = Executors.newFixedThreadPool(Math.max(1, Math.min(groups.size(), 4)));
        ExecutorService deliveryExecutor = Executors.newFixedThreadPool(config.deliveryThreads());
        try {
            DispatchOrchestrator orchestrator = new DispatchOrchestrator(new DispatchContext(
                    new JsonFileSubscriptionStore(paths.subscriptions(), normalizer),
                    new JsonlAlertLog(paths.sentAlerts(), clock),
                    transport,
                    eventBus,
                    clock,
                    config.suppressionWindow(),
                    groupExecutor,
                    deliveryExecutor
            ));
            DispatchReport report = orchestrator.process(groups);
            printReport(report, out);
            return 0;
        } catch (DispatchFailedException e) {
            printReport(e.report(), out);
            out.println("Dispatch incomplete: " + e.getMessage());
            return 1;
        } finally {
            shutdown(groupExecutor);
            shutdown(deliveryExecutor);
        }
    }

    private static int history(Paths paths, String rawLimit, PrintStream out) {
        int limit;
        try {
            limit = Integer.parseInt(rawLimit);
        } catch (NumberFormatException e) {
            out.println("limit must be a number: " + rawLimit);
            return 2;
        }
        JsonlEventStore journal = new JsonlEventStore(paths.eventJournal());
        for (Event event : journal.query(Instant.EPOCH, Optional.empty(), limit)) {
            out.println(event.timestamp() + " " + event.type() + " " + event);
        }
        journal.countByType(Instant.EPOCH).forEach((type, count) -> out.println("total " + type + ": " + count));
        return 0;
    }

    static AlertTransport transport(Paths paths, Map<String, String> env, Clock clock) {
        if ("smtp".equalsIgnoreCase(env.getOrDefault("EMAIL_MODE", "dev"))) {
            return new SmtpEmailSender(
                    env.getOrDefault("SMTP_SERVER", "smtp.gmail.com"),
                    smtpPort(env.getOrDefault("SMTP_PORT", "465")),
                    env.getOrDefault("EMAIL_ADDRESS", ""),
                    env.getOrDefault("EMAIL_PASSWORD", ""),
                    Duration.ofSeconds(10)
            );
        }
        LOGGER.info("EMAIL_MODE is not smtp; alerts go to " + paths.outbox());
        return new DevOutboxEmailSender(paths.outbox(), clock);
    }

    private static int smtpPort(String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("SMTP_PORT must be a number: " + raw, e);
        }
    }

    private static void printReport(DispatchReport report, PrintStream out) {
        for (GroupResult group : report.groups()) {
            out.println(group.outcome() + " " + group.key() + " (" + group.reportCount() + " report(s))"
                    + (group.error() == null ? "" : " error: " + group.error()));
            for (DeliveryResult delivery : group.deliveries()) {
                out.println("  " + (delivery.success() ? "ok     " : "failed ") + delivery.recipient()
                        + (delivery.success() ? "" : " - " + delivery.message()));
            }
        }
    }

    private static JsonFileSubscriptionStore subscriptions(Paths paths, LocationNormalizer normalizer) {
        return new JsonFileSubscriptionStore(paths.subscriptions(), normalizer);
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    record Paths(Path configDir, Path dataDir, Path logDir) {
        static Paths from(Map<String, String> env) {
            return new Paths(
                    Path.of(env.getOrDefault("CONFIG_DIR", "config")),
                    Path.of(env.getOrDefault("DATA_DIR", "data")),
                    Path.of(env.getOrDefault("LOG_DIR", "logs"))
            );
        }

        Path subscriptions() {
            return dataDir.resolve("subscriptions.json");
        }

        Path sentAlerts() {
            return dataDir.resolve("sent_alerts.jsonl");
        }

        Path reportArchive() {
            return dataDir.resolve("reports.jsonl");
        }

        Path outbox() {
            return dataDir.resolve("outbox.json");
        }

        Path eventJournal() {
            return logDir.resolve("dispatch-events.jsonl");
        }
    }
}
