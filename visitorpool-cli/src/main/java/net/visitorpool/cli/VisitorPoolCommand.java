package net.visitorpool.cli;

import net.visitorpool.core.model.PoolStatus;
import net.visitorpool.core.model.SlotView;
import net.visitorpool.core.service.PoolSettings;
import net.visitorpool.core.spi.Clock;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.concurrent.Callable;

@Command(
        name = "visitor-pool",
        mixinStandardHelpOptions = true,
        description = "Visitor slot pool administration",
        subcommands = {
                VisitorPoolCommand.InitCommand.class,
                VisitorPoolCommand.StatusCommand.class,
                VisitorPoolCommand.ReclaimCommand.class,
                VisitorPoolCommand.SlotsCommand.class
        }
)
public final class VisitorPoolCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Option(names = "--jdbc-url", required = true, description = "JDBC URL of the lease store")
    String jdbcUrl;

    @Option(names = "--username", defaultValue = "", description = "Database user")
    String username;

    @Option(names = "--password", defaultValue = "", description = "Database password")
    String password;

    @Option(names = "--pool-size", defaultValue = "4", description = "Number of visitor slots (N)")
    int poolSize;

    @Option(names = "--lease-lifetime", defaultValue = "PT1H", description = "Lease lifetime, ISO-8601 duration")
    Duration leaseLifetime;

    @Option(names = "--migrate", negatable = true, defaultValue = "true", fallbackValue = "true",
            description = "Apply schema migrations first (default: true)")
    boolean migrate;

    Clock clock = Clock.system();

    public static void main(String[] args) {
        System.exit(new CommandLine(new VisitorPoolCommand()).execute(args));
    }

    @Override
    public void run() {
        spec.commandLine().getOut().println("Use subcommands: init | status | reclaim | slots");
    }

    PoolRuntime runtime() {
        return new PoolRuntime(jdbcUrl, username, password,
                new PoolSettings(poolSize, leaseLifetime), migrate, clock);
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    @Command(name = "init", description = "Create missing visitor identities 1..N with their default workspaces")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        VisitorPoolCommand parent;

        @Override
        public Integer call() throws Exception {
            try (var rt = parent.runtime()) {
                int created = rt.pool().initializePool(parent.poolSize);
                parent.out().printf("created=%d size=%d%n", created, parent.poolSize);
                return 0;
            }
        }
    }

    @Command(name = "status", description = "Print pool counters")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        VisitorPoolCommand parent;

        @Override
        public Integer call() throws Exception {
            try (var rt = parent.runtime()) {
                PoolStatus s = rt.pool().status();
                parent.out().printf("total=%d allocated=%d free=%d expired=%d%n",
                        s.total(), s.allocated(), s.free(), s.expired());
                return 0;
            }
        }
    }

    @Command(name = "reclaim", description = "Deactivate expired leases now")
    static final class ReclaimCommand implements Callable<Integer> {
        @ParentCommand
        VisitorPoolCommand parent;

        @Override
        public Integer call() throws Exception {
            try (var rt = parent.runtime()) {
                parent.out().printf("reclaimed=%d%n", rt.pool().reclaimExpired());
                return 0;
            }
        }
    }

    @Command(name = "slots", description = "Print one line per visitor slot")
    static final class SlotsCommand implements Callable<Integer> {
        @ParentCommand
        VisitorPoolCommand parent;

        @Override
        public Integer call() throws Exception {
            try (var rt = parent.runtime()) {
                for (SlotView v : rt.pool().slots(null)) {
                    if (v.state() == SlotView.State.FREE) {
                        parent.out().printf("%3d  FREE%n", v.number());
                    } else {
                        parent.out().printf("%3d  ALLOCATED  %s  expires=%s  (%d min)%n",
                                v.number(), v.accountRef(), v.expiresAt(), v.minutesRemaining());
                    }
                }
                return 0;
            }
        }
    }
}
