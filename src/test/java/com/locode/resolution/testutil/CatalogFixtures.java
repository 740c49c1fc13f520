package com.locode.resolution.testutil;

import com.locode.resolution.catalog.InMemoryCodeBank;
import com.locode.resolution.core.model.Locode;
import com.locode.resolution.core.model.State;
import com.locode.resolution.core.model.SubDivision;

/**
 * Small hand-built catalog shared by the tests.
 *
 * <p>States US, FR, DE; subdivisions US:NY, US:MA, US:IL, US:MO, FR:75;
 * locodes US NYC, US BOS, US SPI, US SGF, FR PAR, FR NCY (no coordinates), DE BER (no subdivision).
 * Every subdivision reference resolves.</p>
 */
public final class CatalogFixtures {

    private CatalogFixtures() {
    }

    public static InMemoryCodeBank.Builder standardBuilder() {
        return InMemoryCodeBank.builder()
                .add(State.builder().identifier("US").name("United States").alternativeNames("USA").build())
                .add(State.builder().identifier("FR").name("France").build())
                .add(State.builder().identifier("DE").name("Germany").alternativeNames("Deutschland").build())
                .add(subdivision("US", "NY", "New York"))
                .add(subdivision("US", "MA", "Massachusetts"))
                .add(subdivision("US", "IL", "Illinois"))
                .add(subdivision("US", "MO", "Missouri"))
                .add(subdivision("FR", "75", "Paris"))
                .add(Locode.builder().supercode("US").subcode("NYC").subdivisionCode("NY")
                        .name("New York").alternativeNames("NYC").functionCode("1234----")
                        .coordinates(40.71, -74.01).build())
                .add(Locode.builder().supercode("US").subcode("BOS").subdivisionCode("MA")
                        .name("Boston").coordinates(42.36, -71.06).build())
                .add(Locode.builder().supercode("US").subcode("SPI").subdivisionCode("IL")
                        .name("Springfield").coordinates(39.80, -89.64).build())
                .add(Locode.builder().supercode("US").subcode("SGF").subdivisionCode("MO")
                        .name("Springfield").coordinates(37.21, -93.29).build())
                .add(Locode.builder().supercode("FR").subcode("PAR").subdivisionCode("75")
                        .name("Paris").coordinates(48.86, 2.35).build())
                .add(Locode.builder().supercode("FR").subcode("NCY")
                        .name("Nancy").build())
                .add(Locode.builder().supercode("DE").subcode("BER")
                        .name("Berlin").coordinates(52.52, 13.40).build());
    }

    public static InMemoryCodeBank standardBank() {
        return standardBuilder().build();
    }

    /**
     * The standard catalog plus two locodes referencing the missing subdivision US:ZZ.
     */
    public static InMemoryCodeBank bankWithOrphans() {
        return standardBuilder()
                .add(Locode.builder().supercode("US").subcode("ZZA").subdivisionCode("ZZ")
                        .name("Ghost Town").build())
                .add(Locode.builder().supercode("US").subcode("ZZB").subdivisionCode("ZZ")
                        .name("Lost Creek").build())
                .build();
    }

    public static SubDivision subdivision(String state, String code, String name) {
        return SubDivision.builder().supercode(state).subcode(code).name(name).subdivisionType("State").build();
    }
}
