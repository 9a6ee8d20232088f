package com.iimsoft.allocation.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.iimsoft.allocation.domain.AllocationResult;
import com.iimsoft.allocation.domain.PeriodSummary;
import com.iimsoft.allocation.engine.AllocationRun;
import com.iimsoft.allocation.engine.ComponentCommit;
import com.iimsoft.allocation.engine.TierAllocation;
import com.iimsoft.allocation.util.PeriodCalendar;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 报表输出：订单分配明细、周期汇总、档位分配、子件 A 累计对比（CSV）以及整次运行结果（JSON）。
 */
public class IOService {

    public static final String ALLOCATION_REPORT = "allocation_report.csv";
    public static final String PERIOD_SUMMARY = "period_summary.csv";
    public static final String TIER_ALLOCATION = "tier_allocation.csv";
    public static final String COMPONENT_COMMIT = "component_commit_summary.csv";
    public static final String RUN_JSON = "allocation_run.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Writes all five reports into {@code outputDir} and returns their paths.
     */
    public static List<Path> exportAll(AllocationRun run, PeriodCalendar calendar, Path outputDir, Charset charset)
            throws IOException {
        List<Path> written = new ArrayList<>();
        written.add(exportAllocationReportToCsv(run, calendar, outputDir.resolve(ALLOCATION_REPORT).toString(), charset));
        written.add(exportPeriodSummaryToCsv(run, calendar, outputDir.resolve(PERIOD_SUMMARY).toString(), charset));
        written.add(exportTierAllocationToCsv(run, calendar, outputDir.resolve(TIER_ALLOCATION).toString(), charset));
        written.add(exportComponentCommitToCsv(run, calendar, outputDir.resolve(COMPONENT_COMMIT).toString(), charset));
        written.add(exportRunToJson(run, calendar, outputDir.resolve(RUN_JSON).toString()));
        return written;
    }

    /**
     * 订单分配明细：每个周期 backlog 中的每张订单一行。
     * 表头：week,order_id,customer,segment,priority,qty_ordered,qty_allocated,qty_allocated_this_period,status
     */
    public static Path exportAllocationReportToCsv(AllocationRun run, PeriodCalendar calendar, String csvPath,
                                                   Charset charset) throws IOException {
        File file = prepareFile(csvPath);
        try (BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(file), charset))) {
            String sep = System.lineSeparator();
            writer.write("week,order_id,customer,segment,priority,qty_ordered,qty_allocated,qty_allocated_this_period,status");
            writer.write(sep);
            for (AllocationResult r : run.getAllocationResults()) {
                writer.write(String.join(",",
                        calendar.labelOf(r.getPeriod()),
                        csv(r.getOrderId()),
                        csv(r.getCustomerId()),
                        csv(r.getSegment()),
                        r.getPriorityTier().name(),
                        String.valueOf(r.getQtyOrdered()),
                        String.valueOf(r.getQtyAllocated()),
                        String.valueOf(r.getQtyAllocatedThisPeriod()),
                        r.getStatus().getLabel()
                ));
                writer.write(sep);
            }
            writer.flush();
        }
        return file.toPath();
    }

    /**
     * 周期汇总：供给、上限、需求、分配、结转 backlog 与约束来源，以及各项累计值。
     */
    public static Path exportPeriodSummaryToCsv(AllocationRun run, PeriodCalendar calendar, String csvPath,
                                                Charset charset) throws IOException {
        File file = prepareFile(csvPath);
        try (BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(file), charset))) {
            String sep = System.lineSeparator();
            writer.write("week,supply_a,supply_b,base_limit,reserved,global_limit,new_demand,total_demand,total_allocated,closing_backlog,constraint,"
                    + "cum_supply_a,cum_supply_b,cum_demand,cum_allocated,cum_backlog");
            writer.write(sep);
            for (PeriodSummary s : run.getPeriodSummaries()) {
                writer.write(String.join(",",
                        calendar.labelOf(s.getPeriod()),
                        String.valueOf(s.getSubcomponentAQty()),
                        String.valueOf(s.getSubcomponentBQty()),
                        String.valueOf(s.getBaseLimit()),
                        String.valueOf(s.getReservedQty()),
                        String.valueOf(s.getGlobalLimit()),
                        String.valueOf(s.getNewDemand()),
                        String.valueOf(s.getTotalDemand()),
                        String.valueOf(s.getTotalAllocated()),
                        String.valueOf(s.getClosingBacklog()),
                        s.getConstrainingSubcomponent().getLabel(),
                        String.valueOf(s.getCumulativeSupplyA()),
                        String.valueOf(s.getCumulativeSupplyB()),
                        String.valueOf(s.getCumulativeDemand()),
                        String.valueOf(s.getCumulativeAllocated()),
                        String.valueOf(s.getCumulativeBacklog())
                ));
                writer.write(sep);
            }
            writer.flush();
        }
        return file.toPath();
    }

    public static Path exportTierAllocationToCsv(AllocationRun run, PeriodCalendar calendar, String csvPath,
                                                 Charset charset) throws IOException {
        File file = prepareFile(csvPath);
        try (BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(file), charset))) {
            String sep = System.lineSeparator();
            writer.write("week,priority,tier_demand,tier_allocation");
            writer.write(sep);
            for (TierAllocation t : run.getTierAllocations()) {
                writer.write(String.join(",",
                        calendar.labelOf(t.getPeriod()),
                        t.getTier().name(),
                        String.valueOf(t.getTierDemand()),
                        String.valueOf(t.getTierAllocation())
                ));
                writer.write(sep);
            }
            writer.flush();
        }
        return file.toPath();
    }

    /**
     * 子件 A 累计到货对比累计需求目标（目标含下一周期订单）。
     */
    public static Path exportComponentCommitToCsv(AllocationRun run, PeriodCalendar calendar, String csvPath,
                                                  Charset charset) throws IOException {
        File file = prepareFile(csvPath);
        try (BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(file), charset))) {
            String sep = System.lineSeparator();
            writer.write("week,target_cumulative,supply_a_cumulative,supply_a_standing");
            writer.write(sep);
            for (ComponentCommit c : run.getComponentCommits()) {
                writer.write(String.join(",",
                        calendar.labelOf(c.getPeriod()),
                        String.valueOf(c.getTargetCumulative()),
                        String.valueOf(c.getSupplyACumulative()),
                        String.valueOf(c.getSupplyAStanding())
                ));
                writer.write(sep);
            }
            writer.flush();
        }
        return file.toPath();
    }

    public static Path exportRunToJson(AllocationRun run, PeriodCalendar calendar, String jsonPath) throws IOException {
        File file = prepareFile(jsonPath);
        Map<Integer, String> weeks = new LinkedHashMap<>();
        for (PeriodSummary s : run.getPeriodSummaries()) {
            weeks.put(s.getPeriod(), calendar.labelOf(s.getPeriod()));
        }
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("weeks", weeks);
        doc.put("periodSummaries", run.getPeriodSummaries());
        doc.put("tierAllocations", run.getTierAllocations());
        doc.put("allocationResults", run.getAllocationResults());
        doc.put("componentCommits", run.getComponentCommits());
        doc.put("openBacklog", run.getOpenBacklog());
        MAPPER.writeValue(file, doc);
        return file.toPath();
    }

    // 相对路径按工作目录解析；已存在则覆盖，父目录不存在则创建
    private static File prepareFile(String path) throws IOException {
        File file = new File(path);
        if (!file.isAbsolute()) {
            String cwd = System.getProperty("user.dir");
            file = new File(cwd, path);
        }
        if (file.exists()) {
            if (file.isDirectory()) {
                throw new IOException("target path is a directory: " + file.getAbsolutePath());
            }
            if (!file.delete()) {
                throw new IOException("cannot delete file: " + file.getAbsolutePath());
            }
        } else {
            File parent = file.getParentFile();
            if (parent != null && !parent.exists() && !parent.mkdirs()) {
                throw new IOException("cannot create directory: " + parent.getAbsolutePath());
            }
        }
        return file;
    }

    private static String csv(String value) {
        if (value == null) {
            return "";
        }
        if (value.indexOf(',') >= 0 || value.indexOf('"') >= 0 || value.indexOf('\n') >= 0) {
            return '"' + value.replace("\"", "\"\"") + '"';
        }
        return value;
    }
}
