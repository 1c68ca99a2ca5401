package org.taskfarm.cli.commands;

import java.io.PrintWriter;

import org.taskfarm.farm.FarmReport;

final class Reports {

    private Reports() {
    }

    static void print(PrintWriter out, FarmReport report) {
        out.printf("Generated %d values in %d batches (%d ms, %.0f values/s)%n",
            report.accounting().deliveredTotal(), report.accounting().batchesDelivered(),
            report.elapsed().toMillis(), report.valuesPerSecond());
        out.printf("Output: %s%n", report.sinkDescription());
        out.flush();
    }
}
