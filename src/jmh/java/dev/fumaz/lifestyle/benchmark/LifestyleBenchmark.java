package dev.fumaz.lifestyle.benchmark;

import dev.fumaz.lifestyle.InstanceProducer;
import dev.fumaz.lifestyle.Lifestyle;
import dev.fumaz.lifestyle.container.Container;
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
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;

import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class LifestyleBenchmark {

    @State(Scope.Benchmark)
    public static class ContainerState {

        Container container;
        InstanceProducer<SingletonService> singleton;
        InstanceProducer<TransientService> transientProducer;
        InstanceProducer<TransientService> hybrid;
        boolean preferSingleton;

        @Setup(Level.Trial)
        public void setUp() {
            container = Container.create();
            container.register(SingletonService.class, SingletonService.class, Lifestyle.SINGLETON);
            container.register(CompositeService.class, CompositeService.class, Lifestyle.TRANSIENT);

            singleton = Lifestyle.SINGLETON.createProducer(SingletonService.class, container);
            transientProducer = Lifestyle.TRANSIENT.createProducer(TransientService.class, TransientService::new,
                    container);
            hybrid = Lifestyle.createHybrid(() -> preferSingleton, Lifestyle.SINGLETON, Lifestyle.TRANSIENT)
                    .createProducer(TransientService.class, TransientService::new, container);
        }
    }

    @Benchmark
    public Object singletonFastPath(ContainerState state) {
        return state.singleton.getInstance();
    }

    @Benchmark
    @Threads(4)
    public Object contendedSingletonFastPath(ContainerState state) {
        return state.singleton.getInstance();
    }

    @Benchmark
    public Object guardedTransient(ContainerState state) {
        return state.transientProducer.getInstance();
    }

    @Benchmark
    public Object hybridSelection(ContainerState state) {
        return state.hybrid.getInstance();
    }

    @Benchmark
    public Object resolveCompositeGraph(ContainerState state) {
        return state.container.getInstance(CompositeService.class);
    }

    public static class SingletonService {
    }

    public static class TransientService {
    }

    public static class LeafService {
    }

    public static class CompositeService {
        private final SingletonService singleton;
        private final LeafService leaf;

        public CompositeService(SingletonService singleton, LeafService leaf) {
            this.singleton = singleton;
            this.leaf = leaf;
        }
    }
}
