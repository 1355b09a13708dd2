package com.example.canonical.ingestion.schema;

import java.util.List;
import java.util.Set;

/**
 * Built-in catalog for the canonical projection, ADP and team-ranking files.
 */
public final class DefaultSchemas {

    public static final String PROJECTIONS = "projections_2025.csv";
    public static final String ADP = "adp0_2025.csv";
    public static final String PRESEASON_RANKINGS = "preseason_rankings_2025.csv";

    private DefaultSchemas() {
    }

    public static SchemaRegistry registry(ReferenceData reference) {
        return new SchemaRegistry(catalog(reference));
    }

    public static List<FileSchema> catalog(ReferenceData reference) {
        return List.of(projections(reference), adp(reference), preseasonRankings(reference));
    }

    static FileSchema projections(ReferenceData reference) {
        return FileSchema.of(PROJECTIONS, List.of(
                ColumnSpec.integer("fantasyPointsRank", false, 1, 1000),
                ColumnSpec.string("playerName", false).toBuilder().playerName(true).build(),
                team("teamName", false, reference),
                position("position", reference),
                ColumnSpec.integer("byeWeek", true, 1, 18),
                ColumnSpec.decimal("games", true, 0, 17),
                ColumnSpec.decimal("fantasyPoints", false, 0, 500),
                ColumnSpec.integer("auctionValue", true, 0, 200),
                ColumnSpec.decimal("passComp", true, 0, 1000),
                ColumnSpec.decimal("passAtt", true, 0, 1000),
                ColumnSpec.decimal("passYds", true, 0, 10000),
                ColumnSpec.decimal("passTd", true, 0, 100),
                ColumnSpec.decimal("passInt", true, 0, 50),
                ColumnSpec.decimal("passSacked", true, 0, 100),
                ColumnSpec.decimal("rushAtt", true, 0, 500),
                ColumnSpec.decimal("rushYds", true, -100, 3000),
                ColumnSpec.decimal("rushTd", true, 0, 30),
                ColumnSpec.decimal("recvTargets", true, 0, 300),
                ColumnSpec.decimal("recvReceptions", true, 0, 200),
                ColumnSpec.decimal("recvYds", true, 0, 3000),
                ColumnSpec.decimal("recvTd", true, 0, 30),
                ColumnSpec.decimal("fumbles", true, 0, 20),
                ColumnSpec.decimal("fumblesLost", true, 0, 20),
                ColumnSpec.decimal("twoPt", true, 0, 10)),
                List.of("playerName", "position", "teamName"));
    }

    static FileSchema adp(ReferenceData reference) {
        return FileSchema.of(ADP, List.of(
                ColumnSpec.integer("Overall Rank", false, 1, 600),
                ColumnSpec.string("Full Name", false).toBuilder().playerName(true).build(),
                team("Team Abbreviation", false, reference),
                position("Position", reference),
                ColumnSpec.integer("Position Rank", false, 1, 200),
                ColumnSpec.integer("Bye Week", true, 1, 18),
                ColumnSpec.decimal("ADP", true, 1, 300),
                ColumnSpec.decimal("Projected Points", true, 0, 500),
                ColumnSpec.integer("Auction Value", true, 0, 200),
                ColumnSpec.builder().name("Is Rookie").type(ColumnType.STRING).nullable(true)
                        .allowedValues(Set.of("Yes", "No")).build(),
                ColumnSpec.string("Data Status", true)),
                List.of("Full Name", "Position", "Team Abbreviation"));
    }

    static FileSchema preseasonRankings(ReferenceData reference) {
        return FileSchema.of(PRESEASON_RANKINGS, List.of(
                team("Team", false, reference).toBuilder().primaryKey(true).unique(true).build(),
                ColumnSpec.decimal("Point Spread Rating Points", true),
                ColumnSpec.decimal("Point Spread Rating QB", true),
                ColumnSpec.decimal("Strength of Schedule To Date", true),
                ColumnSpec.builder().name("Strength of Schedule Remaining").type(ColumnType.INTEGER).nullable(true)
                        .build(),
                ColumnSpec.decimal("Projections Avg. Wins", true, 0, 17),
                ColumnSpec.decimal("Projections Make Playoffs", true, 0, 100),
                ColumnSpec.decimal("Projections Win Division Title", true, 0, 100),
                ColumnSpec.decimal("Projections Win Conf Champ", true, 0, 100),
                ColumnSpec.decimal("Projections Win Super Bowl", true, 0, 100)),
                List.of());
    }

    private static ColumnSpec team(String name, boolean nullable, ReferenceData reference) {
        return ColumnSpec.builder()
                .name(name)
                .type(ColumnType.STRING)
                .nullable(nullable)
                .allowedValues(reference.validTeams())
                .aliases(reference.teamAliases())
                .teamCode(true)
                .build();
    }

    private static ColumnSpec position(String name, ReferenceData reference) {
        return ColumnSpec.builder()
                .name(name)
                .type(ColumnType.STRING)
                .nullable(false)
                .allowedValues(reference.validPositions())
                .build();
    }
}
