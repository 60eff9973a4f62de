package planner;

import planner.catalog.Catalog;
import planner.config.PlannerConfig;
import planner.core.PlanRequest;
import planner.core.PlanResult;
import planner.core.RankingPolicy;
import planner.core.TimetablePlanner;
import planner.export.CandidateExporter;
import planner.export.CandidateReport;
import planner.io.TimeSlotParser;
import planner.model.Category;
import planner.model.Offering;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Usage: {@code Main [CONFLICT_FIRST|PRIORITY_FIRST] [maxCandidates] [exportDir]}
 */
public class Main {
    public static void main(String[] args) {
        RankingPolicy policy = RankingPolicy.CONFLICT_FIRST;
        int cap = PlannerConfig.DEFAULT_MAX_CANDIDATES;
        Path exportDir = null;
        PlanRequest request;
        try {
            if (args.length > 0)
                policy = RankingPolicy.valueOf(args[0].trim().toUpperCase(Locale.ROOT));
            if (args.length > 1)
                cap = Integer.parseInt(args[1].trim());
            if (args.length > 2)
                exportDir = Path.of(args[2]);
            request = new PlanRequest(policy, cap);
        } catch (IllegalArgumentException e) {
            System.err.println("Usage: Main [CONFLICT_FIRST|PRIORITY_FIRST] [maxCandidates] [exportDir]");
            System.err.println(e.getMessage());
            System.exit(2);
            return;
        }

        Catalog catalog = sampleCatalog();
        TimetablePlanner planner = new TimetablePlanner();
        PlanResult result = planner.evaluate(catalog.listOfferings(), request);

        if (result.isFailed()) {
            System.err.println(result.getFailureReason());
            System.exit(1);
            return;
        }
        if (result.isTruncated()) {
            System.out.println("Only the first " + cap + " of " + result.getProductSize()
                    + " combinations were generated.");
        }

        CandidateReport.describeAll("Plans without conflicts", result.getClean()).forEach(System.out::println);
        CandidateReport.describeAll("Plans with conflicts", result.getConflicting()).forEach(System.out::println);

        if (exportDir != null) {
            try {
                Files.createDirectories(exportDir);
                CandidateExporter.exportExcel(result, exportDir.resolve("plans.xlsx"));
                CandidateExporter.exportPdf(result, exportDir.resolve("plans.pdf"));
                System.out.println("Exported plans to " + exportDir.toAbsolutePath());
            } catch (IOException e) {
                System.err.println("EXPORT ERROR: " + e.getMessage());
                System.exit(1);
            }
        }
    }

    static Catalog sampleCatalog() {
        Catalog catalog = new Catalog();
        catalog.addOffering(Offering.builder("Calculus", "01").category(Category.REQUIRED)
                .credits(3).priority(5).mandatory(true).teacher("Lin")
                .timeSlots(TimeSlotParser.parse("Mon 1; Mon 2; Wed 3")).build());
        catalog.addOffering(Offering.builder("Calculus", "02").category(Category.REQUIRED)
                .credits(3).priority(3).teacher("Chen")
                .timeSlots(TimeSlotParser.parse("Tue 3; Tue 4; Thu 1")).build());
        catalog.addOffering(Offering.builder("Physics", "01").category(Category.REQUIRED)
                .credits(3).priority(4).teacher("Wang")
                .timeSlots(TimeSlotParser.parse("Mon 2; Fri 6 B312; Fri 7 B312")).build());
        catalog.addOffering(Offering.builder("Physics", "02").category(Category.REQUIRED)
                .credits(3).priority(2).teacher("Huang")
                .timeSlots(TimeSlotParser.parse("Wed 5; Wed 6")).build());
        catalog.addOffering(Offering.builder("Art History", "01").category(Category.ELECTIVE)
                .credits(2).priority(2)
                .timeSlots(TimeSlotParser.parse("Thu 1; Thu 2")).build());
        catalog.addOffering(Offering.builder("Art History", "02").category(Category.ELECTIVE)
                .credits(2).priority(1).excluded(true)
                .timeSlots(TimeSlotParser.parse("Fri 8")).build());
        catalog.addOffering(Offering.builder("Seminar", "01").category(Category.ELECTIVE)
                .credits(1).priority(3).notes("Online")
                .build());
        return catalog;
    }
}
