package dev.fumaz.conduit.benchmark;

import dev.fumaz.conduit.annotation.Inject;
import dev.fumaz.conduit.container.ConduitContainer;
import dev.fumaz.conduit.lifetime.Lifetime;
import dev.fumaz.conduit.module.ConduitModule;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class ContainerBenchmark {

    @State(Scope.Benchmark)
    public static class ContainerState {

        ConduitContainer container;
        ConduitContainer namespaced;

        @Setup(Level.Trial)
        public void setUp() {
            container = ConduitContainer.create(new BenchmarkModule());

            namespaced = new ConduitContainer();
            namespaced.addNamespace(ContainerBenchmark.class.getPackageName(), Lifetime.TRANSIENT);
        }
    }

    @Benchmark
    public Object getSingleton(ContainerState state) {
        return state.container.get(Clock.class);
    }

    @Benchmark
    public Object getCompositeGraph(ContainerState state) {
        return state.container.get(CompositeService.class);
    }

    @Benchmark
    public Object getCompositeGraphFromNamespace(ContainerState state) {
        return state.namespaced.get(CompositeService.class);
    }

    @Benchmark
    public void unresolvedLookup(ContainerState state, Blackhole blackhole) {
        try {
            blackhole.consume(state.container.get(UnboundType.class));
        } catch (RuntimeException exception) {
            blackhole.consume(exception);
        }
    }

    private static class BenchmarkModule extends ConduitModule {
        @Override
        protected void configure() {
            bind(Clock.class).asSingleton().toSelf();
            bind(Hasher.class).toSelf();
            bind(Repository.class).toSelf();
            bind(Session.class).toSelf();
            bind(CompositeService.class).toSelf();
        }
    }

    public static class Hasher {
        int hash(int seed) {
            int result = seed;
            for (int i = 0; i < 16; i++) {
                result = (result * 31) ^ i;
            }
            return result;
        }
    }

    public static class Clock {
        private final Hasher hasher;

        public Clock(Hasher hasher) {
            this.hasher = hasher;
        }

        int tick() {
            return hasher.hash(1);
        }
    }

    public static class Repository {
        private final Hasher hasher;

        public Repository(Hasher hasher) {
            this.hasher = hasher;
        }

        int lookup(int key) {
            return hasher.hash(key);
        }
    }

    public static class Session {
        private final Repository repository;
        private final Clock clock;

        public Session(Repository repository, Clock clock) {
            this.repository = repository;
            this.clock = clock;
        }

        int open() {
            return repository.lookup(clock.tick());
        }
    }

    public static class CompositeService {
        private final Session session;
        private final Repository repository;

        @Inject
        public CompositeService(Session session, Repository repository) {
            this.session = session;
            this.repository = repository;
        }

        int run() {
            return session.open() + repository.lookup(7);
        }
    }

    public static class UnboundType {
    }
}
