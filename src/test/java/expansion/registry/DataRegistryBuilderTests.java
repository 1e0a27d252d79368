package expansion.registry;

import expansion.domain.DemandSlice;
import expansion.domain.Scenario;
import expansion.domain.Technology;
import expansion.utility.DataException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DataRegistryBuilderTests {
    private static List<Technology> buildTechnologies() {
        return Arrays.asList(new Technology("A", 10, 100), new Technology("B", 50, 20));
    }

    private static List<DemandSlice> buildSlices() {
        return Arrays.asList(new DemandSlice("base", 1.0, 0, 100), new DemandSlice("peak", 0.5, 100, 150));
    }

    @Test
    @DisplayName("deterministic data gets a single implicit scenario built from slice widths")
    void testImplicitScenario() throws DataException {
        DataRegistry dataRegistry = new DataRegistryBuilder(buildTechnologies(), buildSlices()).getDataRegistry();
        assertFalse(dataRegistry.isStochastic());
        assertEquals(1, dataRegistry.getNumScenarios());

        Scenario scenario = dataRegistry.getScenarios().get(0);
        assertEquals(1.0, scenario.getProbability());
        assertArrayEquals(new double[]{100, 50}, scenario.getWidths(), 1e-12);
        assertEquals(100, scenario.getMaxWidth(), 1e-12);
    }

    @Test
    @DisplayName("scenario data is kept as given")
    void testStochasticData() throws DataException {
        List<Scenario> scenarios = Arrays.asList(
            new Scenario("low", 0.4, new double[]{100, 50}),
            new Scenario("high", 0.6, new double[]{60, 80}));
        DataRegistry dataRegistry = new DataRegistryBuilder(buildTechnologies(), buildSlices(), scenarios)
            .getDataRegistry();

        assertTrue(dataRegistry.isStochastic());
        assertEquals(Arrays.asList("low", "high"), dataRegistry.getScenarioNames());
        assertArrayEquals(new double[]{0.4, 0.6}, dataRegistry.getProbabilities(), 1e-12);
        assertEquals(Arrays.asList("A", "B"), dataRegistry.getTechnologyNames());
        assertEquals(100 * 2 + 20 * 3, dataRegistry.getInvestmentCost(new double[]{2, 3}), 1e-12);
        assertEquals(50, dataRegistry.getMaxMarginalCost(), 1e-12);
        assertThrows(UnsupportedOperationException.class,
            () -> dataRegistry.getTechnologies().add(new Technology("C", 1, 1)));
    }

    @Test
    @DisplayName("probabilities that do not sum to 1 are rejected")
    void testProbabilitySum() {
        List<Scenario> scenarios = Arrays.asList(
            new Scenario("low", 0.4, new double[]{100, 50}),
            new Scenario("high", 0.5, new double[]{60, 80}));
        assertThrows(DataException.class,
            () -> new DataRegistryBuilder(buildTechnologies(), buildSlices(), scenarios));
    }

    @Test
    @DisplayName("probabilities outside (0,1] are rejected")
    void testProbabilityRange() {
        List<Scenario> scenarios = Arrays.asList(
            new Scenario("low", 0.0, new double[]{100, 50}),
            new Scenario("high", 1.0, new double[]{60, 80}));
        assertThrows(DataException.class,
            () -> new DataRegistryBuilder(buildTechnologies(), buildSlices(), scenarios));
    }

    @Test
    @DisplayName("scenarios must carry one width per slice")
    void testWidthCount() {
        List<Scenario> scenarios = Collections.singletonList(new Scenario("only", 1.0, new double[]{100}));
        assertThrows(DataException.class,
            () -> new DataRegistryBuilder(buildTechnologies(), buildSlices(), scenarios));
    }

    @Test
    @DisplayName("negative widths are rejected")
    void testNegativeWidth() {
        List<DemandSlice> slices = Collections.singletonList(new DemandSlice("base", 1.0, 100, 50));
        assertThrows(DataException.class, () -> new DataRegistryBuilder(buildTechnologies(), slices));

        List<Scenario> scenarios = Collections.singletonList(new Scenario("only", 1.0, new double[]{100, -1}));
        assertThrows(DataException.class,
            () -> new DataRegistryBuilder(buildTechnologies(), buildSlices(), scenarios));
    }

    @Test
    @DisplayName("empty and duplicate records are rejected")
    void testMissingAndDuplicateRecords() {
        assertThrows(DataException.class, () -> new DataRegistryBuilder(new ArrayList<>(), buildSlices()));
        assertThrows(DataException.class, () -> new DataRegistryBuilder(buildTechnologies(), new ArrayList<>()));

        List<Technology> duplicates = Arrays.asList(new Technology("A", 10, 100), new Technology("A", 50, 20));
        assertThrows(DataException.class, () -> new DataRegistryBuilder(duplicates, buildSlices()));

        List<DemandSlice> zeroDuration = Collections.singletonList(new DemandSlice("base", 0.0, 0, 100));
        assertThrows(DataException.class, () -> new DataRegistryBuilder(buildTechnologies(), zeroDuration));

        List<Technology> negativeCost = Collections.singletonList(new Technology("A", -1, 100));
        assertThrows(DataException.class, () -> new DataRegistryBuilder(negativeCost, buildSlices()));
    }

    @Test
    @DisplayName("slice categories that differ only in case are duplicates")
    void testCaseInsensitiveSlices() {
        List<DemandSlice> slices = Arrays.asList(new DemandSlice("Base", 1.0, 0, 100),
            new DemandSlice("base", 0.5, 100, 150));
        assertThrows(DataException.class, () -> new DataRegistryBuilder(buildTechnologies(), slices));
    }
}
