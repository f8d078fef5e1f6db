package com.covidamp.api;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.covidamp.api.TestPlaces.ALAMEDA;
import static com.covidamp.api.TestPlaces.CALIFORNIA;
import static com.covidamp.api.TestPlaces.KINGS;
import static com.covidamp.api.TestPlaces.NEW_YORK;
import static com.covidamp.api.TestPlaces.USA;
import static com.covidamp.api.TestPlaces.policy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AllTimeMaxCounterTest {

    private static final Clock TODAY = Clock.fixed(Instant.parse("2020-06-30T12:00:00Z"), ZoneOffset.UTC);
    private static final PolicyCountProperties PROPERTIES = new PolicyCountProperties(true, LocalDate.of(2019, 1, 1), 100, Duration.ofHours(1));

    private static AllTimeMaxCounter counterFor(FakePolicyRecordSource source) {
        return new AllTimeMaxCounter(source, new GroupDeduplicator(), TODAY, PROPERTIES);
    }

    private static FakePolicyRecordSource overlappingStatePolicies() {
        return new FakePolicyRecordSource()
            .add(policy(1, null, "2020-03-01", "2020-04-30", CALIFORNIA))
            .add(policy(2, null, "2020-04-01", null, CALIFORNIA))
            .add(policy(3, null, "2020-03-15", "2020-05-31", NEW_YORK))
            .add(policy(4, null, "2020-04-10", "2020-04-20", NEW_YORK))
            .add(policy(5, 7, "2020-04-15", "2020-04-25", NEW_YORK))
            .add(policy(6, 7, "2020-04-15", "2020-04-15", NEW_YORK));
    }

    @Test
    void findsHighestSimultaneousCountWithoutGrouping() {
        MinMax minMax = counterFor(overlappingStatePolicies()).findMinMax(GeoRes.state, Map.of(), false);

        assertThat(minMax.max()).isEqualTo(new PlaceObs(null, "New York", 4, LocalDate.of(2020, 4, 15)));
        assertThat(minMax.min().value()).isEqualTo(1);
    }

    @Test
    void groupingDropsDuplicatesAndLatestDateWinsTies() {
        MinMax minMax = counterFor(overlappingStatePolicies()).findMinMax(GeoRes.state, Map.of(), true);

        assertThat(minMax.max()).isEqualTo(new PlaceObs(null, "New York", 3, LocalDate.of(2020, 4, 20)));
    }

    @Test
    void equalCountsOnSameDayBreakTiesByLocation() {
        Place autauga = new Place(70L, "Local", "USA", "Alabama", "Autauga County, AL", "1001");
        Place baldwin = new Place(71L, "Local", "USA", "Alabama", "Baldwin County, AL", "1003");
        FakePolicyRecordSource source = new FakePolicyRecordSource()
            .add(policy(1, null, "2020-05-01", "2020-05-10", autauga))
            .add(policy(2, null, "2020-05-01", "2020-05-10", baldwin));

        MinMax minMax = counterFor(source).findMinMax(GeoRes.county, Map.of(), false);

        assertThat(minMax.max()).isEqualTo(new PlaceObs(null, "01003", 1, LocalDate.of(2020, 5, 10)));
    }

    @Test
    void scanIsClippedToWindowAndToday() {
        FakePolicyRecordSource source = new FakePolicyRecordSource()
            .add(policy(1, null, "2018-06-01", "2018-12-31", USA))
            .add(policy(2, null, "2018-06-01", "2019-01-10", USA))
            .add(policy(3, null, "2018-07-01", "2019-01-05", USA))
            .add(policy(4, null, "2020-07-01", null, USA))
            .add(policy(5, null, null, null, USA));

        MinMax minMax = counterFor(source).findMinMax(GeoRes.country, Map.of(), false);

        assertThat(minMax.max()).isEqualTo(new PlaceObs(null, "USA", 2, LocalDate.of(2019, 1, 5)));
    }

    @Test
    void onlyPlacesAtTargetLevelCount() {
        FakePolicyRecordSource source = new FakePolicyRecordSource()
            .add(policy(1, null, "2020-03-01", null, ALAMEDA, KINGS, CALIFORNIA))
            .add(policy(2, null, "2020-03-01", null, CALIFORNIA));

        MinMax minMax = counterFor(source).findMinMax(GeoRes.county, Map.of(), false);

        assertThat(minMax.max()).isEqualTo(new PlaceObs(null, "36047", 1, LocalDate.of(2020, 6, 30)));
    }

    @Test
    void noPoliciesInEffectYieldsNoObservation() {
        MinMax minMax = counterFor(new FakePolicyRecordSource()).findMinMax(GeoRes.state, Map.of(), true);

        assertThat(minMax).isEqualTo(MinMax.NONE);
        assertThat(minMax.min()).isNull();
        assertThat(minMax.max()).isNull();
    }

    @Test
    void moreThanOneLevelIsRejected() {
        AllTimeMaxCounter counter = counterFor(overlappingStatePolicies());
        Map<String, List<String>> filters = Map.of(PolicyFilters.LEVEL, List.of("Local", "State / Province"));

        assertThatThrownBy(() -> counter.findMinMax(GeoRes.state, filters, false))
            .isInstanceOf(UnsupportedOperationException.class)
            .hasMessageContaining("more than one level");
    }

    @Test
    void categoryFiltersNarrowTheScan() {
        FakePolicyRecordSource source = new FakePolicyRecordSource()
            .add(policy(1, null, "2020-03-01", null, CALIFORNIA), Map.of("primary_ph_measure", "Social distancing"))
            .add(policy(2, null, "2020-03-01", null, CALIFORNIA), Map.of("primary_ph_measure", "Vaccinations"));
        Map<String, List<String>> filters = Map.of("primary_ph_measure", List.of("Vaccinations"));

        MinMax minMax = counterFor(source).findMinMax(GeoRes.state, filters, false);

        assertThat(minMax.max()).isEqualTo(new PlaceObs(null, "California", 1, LocalDate.of(2020, 6, 30)));
    }
}
