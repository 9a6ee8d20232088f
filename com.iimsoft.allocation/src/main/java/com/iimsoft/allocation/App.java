package com.iimsoft.allocation;

import com.iimsoft.allocation.config.AllocationConfig;
import com.iimsoft.allocation.domain.InvalidInputException;
import com.iimsoft.allocation.domain.PeriodSummary;
import com.iimsoft.allocation.engine.AllocationComputationException;
import com.iimsoft.allocation.engine.AllocationEngine;
import com.iimsoft.allocation.engine.AllocationRun;
import com.iimsoft.allocation.service.AllocationInput;
import com.iimsoft.allocation.service.DataBuildService;
import com.iimsoft.allocation.service.IOService;
import com.iimsoft.allocation.util.MockDataGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * 命令行入口：读取最新快照 -> 分配 -> 输出报表。
 * <pre>
 * App [--generate] [config.json]
 * </pre>
 * --generate：先用 mock 数据生成一份新快照（输入目录里没有快照时也会自动生成）。
 */
public class App {

    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    private static final DateTimeFormatter SNAPSHOT_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    public static void main(String[] args) {
        int code = new App().run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    public int run(String[] args) {
        boolean generate = false;
        String configPath = null;
        for (String arg : args) {
            if ("--generate".equals(arg)) {
                generate = true;
            } else {
                configPath = arg;
            }
        }

        LOGGER.info("======================================");
        LOGGER.info("Constrained Supply Allocation");
        LOGGER.info("======================================");

        try {
            AllocationConfig config = configPath == null
                    ? AllocationConfig.loadDefault()
                    : AllocationConfig.load(Paths.get(configPath));
            DataBuildService dataBuildService = new DataBuildService();
            Path inputDir = Paths.get(config.getInputDirectory());

            Path snapshot = generate ? null : findSnapshot(dataBuildService, config, inputDir);
            if (snapshot == null) {
                snapshot = generateSnapshot(dataBuildService, config, inputDir);
            }
            AllocationInput input = dataBuildService.buildFromFile(snapshot);

            long startTime = System.currentTimeMillis();
            AllocationRun run = new AllocationEngine(config.isLookaheadEnabled())
                    .run(input.getSupplies(), input.getOrders());
            long endTime = System.currentTimeMillis();

            LOGGER.info("Allocation completed in {} ms", (endTime - startTime));
            for (PeriodSummary s : run.getPeriodSummaries()) {
                LOGGER.info("{}  limit={} ({})  demand={}  allocated={}  backlog={}",
                        input.getCalendar().labelOf(s.getPeriod()), s.getGlobalLimit(),
                        s.getConstrainingSubcomponent().getLabel(), s.getTotalDemand(),
                        s.getTotalAllocated(), s.getClosingBacklog());
            }

            List<Path> reports = IOService.exportAll(run, input.getCalendar(),
                    Paths.get(config.getOutputDirectory()), config.charset());
            reports.forEach(p -> LOGGER.info("Report saved: {}", p));
            return 0;
        } catch (InvalidInputException e) {
            LOGGER.error("Input rejected: {}", e.getMessage(), e);
            return 2;
        } catch (AllocationComputationException e) {
            LOGGER.error("Allocation aborted: {}", e.getMessage(), e);
            return 3;
        } catch (IOException e) {
            LOGGER.error("I/O failure: {}", e.getMessage(), e);
            return 1;
        }
    }

    private Path findSnapshot(DataBuildService service, AllocationConfig config, Path inputDir) throws IOException {
        try {
            return service.findLatestSnapshot(inputDir, config.getInputPattern());
        } catch (NoSuchFileException e) {
            LOGGER.warn("No snapshot matching {} in {}, generating mock data", config.getInputPattern(), inputDir);
            return null;
        }
    }

    private Path generateSnapshot(DataBuildService service, AllocationConfig config, Path inputDir) throws IOException {
        MockDataGenerator generator = new MockDataGenerator(config.getMockSeed());
        String name = "allocation_input_" + LocalDateTime.now().format(SNAPSHOT_STAMP) + ".json";
        return service.writeSnapshot(
                generator.generate(LocalDate.parse(config.getMockStartDate()), config.getMockWeeks()),
                inputDir.resolve(name));
    }
}
