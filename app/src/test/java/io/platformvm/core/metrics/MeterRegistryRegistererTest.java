package io.platformvm.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MeterRegistryRegistererTest {

    @Test
    void rejectsSecondMetricWithSameName() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MeterRegistryRegisterer registerer = new MeterRegistryRegisterer(registry);
        MetricDescriptor descriptor = new MetricDescriptor("platformvm", "abort_blks_accepted", "Number of abort blocks accepted");

        registerer.register(new AcceptanceCounter(descriptor));
        DuplicateMetricException e = assertThrows(DuplicateMetricException.class,
                () -> registerer.register(new AcceptanceCounter(descriptor)));

        assertTrue(e.getMessage().contains("platformvm_abort_blks_accepted"));
        assertEquals(1, registry.getMeters().size());
    }

    @Test
    void rejectsNameAlreadyUsedByAnotherMeter() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        registry.counter("platformvm_export_txs_accepted");
        MeterRegistryRegisterer registerer = new MeterRegistryRegisterer(registry);

        assertThrows(DuplicateMetricException.class, () -> registerer.register(new AcceptanceCounter(
                new MetricDescriptor("platformvm", "export_txs_accepted", "Number of export transactions accepted"))));
    }

    @Test
    void registeredCounterReportsIncrements() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MeterRegistryRegisterer registerer = new MeterRegistryRegisterer(registry);
        AcceptanceCounter counter = new AcceptanceCounter(
                new MetricDescriptor("", "standard_blks_accepted", "Number of standard blocks accepted"));

        registerer.register(counter);
        counter.increment();
        counter.increment();

        assertEquals(2.0, registry.get("standard_blks_accepted").functionCounter().count());
    }

    @Test
    void rejectsInvalidMetricNames() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MeterRegistryRegisterer registerer = new MeterRegistryRegisterer(registry);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> registerer.register(
                new AcceptanceCounter(new MetricDescriptor("platform-vm", "abort_blks_accepted", ""))));
        assertTrue(e.getMessage().contains("platform-vm_abort_blks_accepted"));
        assertThrows(IllegalArgumentException.class, () -> registerer.register(
                new AcceptanceCounter(new MetricDescriptor("", "9lives", ""))));
        assertTrue(registry.getMeters().isEmpty());
    }

    @Test
    void descriptorRequiresAName() {
        assertThrows(IllegalArgumentException.class, () -> new MetricDescriptor("ns", " ", ""));
        assertThrows(IllegalArgumentException.class, () -> new MetricDescriptor("ns", null, ""));
    }
}
