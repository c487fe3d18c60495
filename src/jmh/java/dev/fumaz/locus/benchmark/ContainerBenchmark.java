package dev.fumaz.locus.benchmark;

import dev.fumaz.locus.bind.RegistrationOption;
import dev.fumaz.locus.container.Container;
import dev.fumaz.locus.exception.NotExistException;
import dev.fumaz.locus.module.LocusModule;
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

import java.util.List;
import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class ContainerBenchmark {

    @State(Scope.Benchmark)
    public static class ContainerState {

        Container container;

        @Setup(Level.Trial)
        public void setUp() {
            container = Container.create();
            container.install(new BenchmarkModule());
        }
    }

    @Benchmark
    public Object resolveStatic(ContainerState state) {
        return state.container.resolve(StaticService.class);
    }

    @Benchmark
    public Object resolveCompositeGraph(ContainerState state) {
        return state.container.resolve(CompositeService.class);
    }

    @Benchmark
    public Object resolveAllPlugins(ContainerState state) {
        return state.container.resolveAll(Plugin.class);
    }

    @Benchmark
    public void unregisteredLookup(ContainerState state, Blackhole blackhole) {
        try {
            blackhole.consume(state.container.resolve(UnregisteredType.class));
        } catch (NotExistException exception) {
            blackhole.consume(exception);
        }
    }

    private static class BenchmarkModule extends LocusModule {
        @Override
        protected void configure() {
            bind(HeavyComputation.class).toConstructor(HeavyComputation.class);
            bind(StaticService.class).with(RegistrationOption.staticLifetime()).toConstructor(StaticService.class);
            bind(TransientService.class).toConstructor(TransientService.class);
            bind(CompositeService.class).toConstructor(CompositeService.class);
            bind(Plugin.class).named("first").toInstance(new Plugin(1));
            bind(Plugin.class).named("second").toInstance(new Plugin(2));
            bind(Plugin.class).toInstance(new Plugin(3));
        }
    }

    public static class StaticService {
        private final HeavyComputation heavyComputation;

        public StaticService(HeavyComputation heavyComputation) {
            this.heavyComputation = heavyComputation;
        }

        public int compute() {
            return heavyComputation.compute();
        }
    }

    public static class TransientService {
        private final HeavyComputation heavyComputation;

        public TransientService(HeavyComputation heavyComputation) {
            this.heavyComputation = heavyComputation;
        }

        public int compute() {
            return heavyComputation.compute();
        }
    }

    public static class CompositeService {
        private final StaticService staticService;
        private final TransientService transientService;
        private final List<Plugin> plugins;

        public CompositeService(StaticService staticService, TransientService transientService, List<Plugin> plugins) {
            this.staticService = staticService;
            this.transientService = transientService;
            this.plugins = plugins;
        }

        public int aggregate() {
            int result = staticService.compute() + transientService.compute();

            for (Plugin plugin : plugins) {
                result += plugin.weight();
            }

            return result;
        }
    }

    public static class Plugin {
        private final int weight;

        public Plugin(int weight) {
            this.weight = weight;
        }

        public int weight() {
            return weight;
        }
    }

    public static class HeavyComputation {
        public int compute() {
            int result = 0;
            for (int i = 0; i < 16; i++) {
                result = (result * 31) ^ i;
            }
            return result;
        }
    }

    public static class UnregisteredType {
    }
}
