package io.indexlist.benchmarks;

import io.indexlist.kernel.Index;
import io.indexlist.kernel.IndexList;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

@State(Scope.Thread)
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 2, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 3, time = 5, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class IndexListBenchmark {

    @Param({"1000", "100000"})
    public int elements;

    private IndexList<Integer> list;
    private List<Index<Integer>> handles;
    private int cursor;

    @Setup(Level.Iteration)
    public void setup() {
        list = IndexList.withCapacity(elements);
        handles = new ArrayList<>(elements);
        for (int i = 0; i < elements; i++) {
            handles.add(i % 2 == 0 ? list.pushBack(i) : list.pushFront(i));
        }
        cursor = 0;
    }

    // Remove one element and push a replacement into the freed slot
    @Benchmark
    public void churn(Blackhole blackhole) {
        var slot = cursor++ % elements;
        blackhole.consume(list.remove(handles.get(slot)));
        handles.set(slot, list.pushBack(slot));
    }

    @Benchmark
    public void lookup(Blackhole blackhole) {
        blackhole.consume(list.get(handles.get(cursor++ % elements)));
    }

    @Benchmark
    public void traverse(Blackhole blackhole) {
        for (Integer value : list) {
            blackhole.consume(value);
        }
    }
}
