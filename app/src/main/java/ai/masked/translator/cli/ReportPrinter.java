package ai.masked.translator.cli;

import ai.masked.translator.filter.FilterStat;
import ai.masked.translator.model.ModelConfig;
import ai.masked.translator.model.ModelRegistry;
import ai.masked.translator.model.UsageMetric;
import ai.masked.translator.prompt.PromptCatalog;
import ai.masked.translator.prompt.PromptInfo;
import ai.masked.translator.translate.TextLengths;
import ai.masked.translator.translate.TranslationReport;
import java.io.PrintWriter;
import java.util.List;
import java.util.Map;

/**
 * Human-readable listings and run summaries for the terminal.
 */
final class ReportPrinter {

    private ReportPrinter() {
    }

    static void printModels(ModelRegistry registry, PrintWriter out) {
        out.println("Available models:");
        for (Map.Entry<String, List<ModelConfig>> vendor : registry.listByVendor().entrySet()) {
            out.println();
            out.println(vendor.getKey() + ":");
            for (ModelConfig model : vendor.getValue()) {
                StringBuilder line = new StringBuilder("  ").append(model.key())
                        .append("  [format=").append(model.format());
                if (model.limits().estimatedMaxChars() > 0) {
                    line.append(", ~").append(model.limits().estimatedMaxChars()).append(" chars");
                }
                line.append(']');
                model.notes().ifPresent(notes -> line.append("  ").append(notes));
                out.println(line);
            }
        }
        out.flush();
    }

    static void printPrompts(PromptCatalog prompts, PrintWriter out) {
        out.println("Available prompts:");
        for (Map.Entry<String, PromptInfo> entry : prompts.list().entrySet()) {
            out.println("  " + entry.getKey() + "  [" + String.join(", ", entry.getValue().formats()) + "]");
            entry.getValue().notes().ifPresent(notes -> out.println("      " + notes));
        }
        out.flush();
    }

    static void printSummary(TranslationReport report, PrintWriter err) {
        TextLengths lengths = report.lengths();
        err.println();
        err.println("Characters:");
        err.println("\tOriginal:    " + lengths.original());
        err.println("\tPrepared:    " + lengths.prepared());
        err.println("\tTranslated:  " + lengths.translated());

        if (!report.filterStats().isEmpty()) {
            err.println();
            err.println("Filters:");
            for (FilterStat stat : report.filterStats()) {
                err.println("\t" + stat.filter() + ":\t" + stat.count() + " placeholder(s)");
            }
        }

        err.println();
        err.println("Usage metrics:");
        if (report.consumed().isEmpty()) {
            err.println("\t(none reported)");
        } else {
            for (Map.Entry<String, UsageMetric> category : report.consumed().categories().entrySet()) {
                err.println("\t" + capitalize(category.getKey()) + ": " + category.getValue().total());
                category.getValue().breakdown().forEach((label, count) ->
                        err.println(String.format("\t\t%-12s %d", capitalize(label) + ":", count)));
            }
        }
        err.flush();
    }

    private static String capitalize(String value) {
        return value.isEmpty() ? value : Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
