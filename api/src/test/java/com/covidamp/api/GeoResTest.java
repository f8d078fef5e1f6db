package com.covidamp.api;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeoResTest {

    @ParameterizedTest
    @CsvSource({
            "country,iso3,Country,global",
            "state,area1,State / Province,us",
            "county,ansi_fips,Local,us-county",
            "county_plus_state,ansi_fips,Local plus state/province,us-county-plus-state"
    })
    void mapsResolutionToFieldLevelAndMapType(String name, String locField, String level, String mapType) {
        GeoRes geoRes = GeoRes.fromName(name);
        assertThat(geoRes.getLocField()).isEqualTo(locField);
        assertThat(geoRes.getLevel()).isEqualTo(level);
        assertThat(geoRes.getMapType()).isEqualTo(mapType);
    }

    @Test
    void unknownNamesAreRejected() {
        assertThatThrownBy(() -> GeoRes.fromName("continent"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("continent");
        assertThatThrownBy(() -> GeoRes.fromName(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @CsvSource({
            "state,country,true",
            "county,state,true",
            "county,country,true",
            "county_plus_state,state,true",
            "state,state,false",
            "state,county,false",
            "country,state,false",
            "country,country,false",
            "county,county_plus_state,false"
    })
    void isChildOfFollowsCountryStateCountyOrder(String child, String parent, boolean expected) {
        assertThat(GeoRes.fromName(child).isChildOf(GeoRes.fromName(parent))).isEqualTo(expected);
    }

    @Test
    void subgeoLevelsAreStrictlyFinerResolutions() {
        assertThat(GeoRes.country.getSubgeoLevels())
            .containsExactly("State / Province", "Local", "Local plus state/province");
        assertThat(GeoRes.state.getSubgeoLevels()).containsExactly("Local", "Local plus state/province");
        assertThat(GeoRes.county.getSubgeoLevels()).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
            "county,6001,06001",
            "county_plus_state,6001,06001",
            "county,36047,36047",
            "county,123,123",
            "state,Iowa,Iowa",
            "country,ABCD,ABCD"
    })
    void fourDigitFipsPaddedOnlyForCountyResolutions(String name, String value, String expected) {
        assertThat(GeoRes.fromName(name).normalizeLocValue(value)).isEqualTo(expected);
    }
}
