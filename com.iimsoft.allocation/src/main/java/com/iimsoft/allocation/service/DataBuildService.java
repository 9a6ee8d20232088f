package com.iimsoft.allocation.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.iimsoft.allocation.domain.CustomerTier;
import com.iimsoft.allocation.domain.DemandOrder;
import com.iimsoft.allocation.domain.InvalidInputException;
import com.iimsoft.allocation.domain.PriorityTier;
import com.iimsoft.allocation.domain.ProductType;
import com.iimsoft.allocation.domain.SupplyRecord;
import com.iimsoft.allocation.dto.ImportDTOs;
import com.iimsoft.allocation.engine.Quantities;
import com.iimsoft.allocation.util.PeriodCalendar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 将 JSON 输入快照转换为经过校验的引擎输入。
 * - 查找输入目录下最新的快照文件
 * - 子件到货明细按 ISO 周、按子件汇总为 SupplyRecord
 * - 订单按客户主数据补齐优先级与细分市场
 * - 任何不合法的数据都直接拒绝（不做默认值填充）
 */
public class DataBuildService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DataBuildService.class);

    static final String UNKNOWN_SEGMENT = "Unknown";

    private final ObjectMapper mapper = new ObjectMapper()
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);

    /**
     * Newest file in {@code directory} matching {@code glob}, by last-modified time.
     */
    public Path findLatestSnapshot(Path directory, String glob) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new NoSuchFileException(directory.toString(), null, "input directory does not exist");
        }
        Path latest = null;
        FileTime latestTime = null;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, glob)) {
            for (Path candidate : stream) {
                if (!Files.isRegularFile(candidate)) {
                    continue;
                }
                FileTime time = Files.getLastModifiedTime(candidate);
                // 时间相同时取文件名较大的（时间戳命名）
                if (latest == null || time.compareTo(latestTime) > 0
                        || (time.compareTo(latestTime) == 0 && candidate.getFileName().toString()
                        .compareTo(latest.getFileName().toString()) > 0)) {
                    latest = candidate;
                    latestTime = time;
                }
            }
        }
        if (latest == null) {
            throw new NoSuchFileException(directory.resolve(glob).toString(), null, "no snapshot found");
        }
        LOGGER.info("Using input snapshot {}", latest);
        return latest;
    }

    /**
     * Writes a snapshot document, e.g. one produced by the mock generator.
     */
    public Path writeSnapshot(ImportDTOs.Root dto, Path jsonPath) throws IOException {
        Path parent = jsonPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(jsonPath.toFile(), dto);
        LOGGER.info("Snapshot written: {} ({} supply lines, {} orders)", jsonPath,
                dto.supplies == null ? 0 : dto.supplies.size(), dto.demands == null ? 0 : dto.demands.size());
        return jsonPath;
    }

    public AllocationInput buildFromFile(Path jsonPath) throws IOException {
        try {
            ImportDTOs.Root dto = mapper.readValue(jsonPath.toFile(), ImportDTOs.Root.class);
            return build(dto);
        } catch (MismatchedInputException e) {
            throw new InvalidInputException("invalid value in " + jsonPath + ": " + e.getOriginalMessage(), e);
        }
    }

    public AllocationInput buildFromJson(String json) throws IOException {
        try {
            return build(mapper.readValue(json, ImportDTOs.Root.class));
        } catch (MismatchedInputException e) {
            throw new InvalidInputException("invalid value: " + e.getOriginalMessage(), e);
        }
    }

    public AllocationInput build(ImportDTOs.Root dto) {
        List<ImportDTOs.CustomerDTO> customerDtos = dto.customers == null ? List.of() : dto.customers;
        List<ImportDTOs.SupplyDTO> supplyDtos = dto.supplies == null ? List.of() : dto.supplies;
        List<ImportDTOs.DemandDTO> demandDtos = dto.demands == null ? List.of() : dto.demands;

        // 1) 客户主数据
        Map<String, CustomerTier> customers = new LinkedHashMap<>();
        for (ImportDTOs.CustomerDTO c : customerDtos) {
            if (c.customer == null || c.customer.isBlank()) {
                throw new InvalidInputException("customer master row without customer name");
            }
            PriorityTier tier = PriorityTier.fromCode(c.priority);
            String segment = c.segment == null || c.segment.isBlank() ? UNKNOWN_SEGMENT : c.segment;
            if (customers.put(c.customer, new CustomerTier(c.customer, tier, segment)) != null) {
                throw new InvalidInputException("duplicate customer in master data: " + c.customer);
            }
        }

        // 2) 周期日历：所有出现过的周
        List<String> weeks = new ArrayList<>();
        for (ImportDTOs.SupplyDTO s : supplyDtos) {
            weeks.add(weekOf(s.week, s.deliveryDate, "supply"));
        }
        for (ImportDTOs.DemandDTO d : demandDtos) {
            weeks.add(weekOf(d.week, d.deliveryDate, "order " + d.orderId));
        }
        if (weeks.isEmpty()) {
            LOGGER.info("Snapshot holds no supply and no demand");
            return new AllocationInput(new PeriodCalendar(LocalDate.now()), customers, List.of(), List.of());
        }
        PeriodCalendar calendar = PeriodCalendar.fromWeeks(weeks);

        // 3) 到货明细 -> 每周期一条 SupplyRecord
        Map<Integer, Map<ProductType, Long>> supplyByPeriod = new TreeMap<>();
        for (ImportDTOs.SupplyDTO s : supplyDtos) {
            int period = calendar.periodOf(weekOf(s.week, s.deliveryDate, "supply"));
            ProductType type = ProductType.fromCode(s.productType);
            int qty = requireQuantity(s.quantity, "supply " + type + " in week " + calendar.labelOf(period));
            if (qty < 0) {
                throw new InvalidInputException("negative supply quantity " + qty + " for " + type
                        + " in week " + calendar.labelOf(period));
            }
            supplyByPeriod.computeIfAbsent(period, k -> new EnumMap<>(ProductType.class))
                    .merge(type, (long) qty, Quantities::add);
        }
        List<SupplyRecord> supplies = new ArrayList<>();
        for (Map.Entry<Integer, Map<ProductType, Long>> e : supplyByPeriod.entrySet()) {
            Map<ProductType, Long> byType = e.getValue();
            supplies.add(new SupplyRecord(e.getKey(),
                    Quantities.toInt(byType.getOrDefault(ProductType.SUBCOMPONENT_A, 0L)),
                    Quantities.toInt(byType.getOrDefault(ProductType.SUBCOMPONENT_B, 0L))));
        }

        // 4) 订单
        Set<String> orderIds = new HashSet<>();
        List<DemandOrder> orders = new ArrayList<>();
        for (ImportDTOs.DemandDTO d : demandDtos) {
            if (d.orderId == null || d.orderId.isBlank()) {
                throw new InvalidInputException("order without order id for customer " + d.customer);
            }
            if (!orderIds.add(d.orderId)) {
                throw new InvalidInputException("duplicate order id: " + d.orderId);
            }
            int qty = requireQuantity(d.quantity, "order " + d.orderId);
            if (qty <= 0) {
                throw new InvalidInputException("order " + d.orderId + " must order a positive quantity: " + qty);
            }
            CustomerTier master = d.customer == null ? null : customers.get(d.customer);
            PriorityTier tier;
            if (d.priority != null && !d.priority.isBlank()) {
                tier = PriorityTier.fromCode(d.priority);
            } else if (master != null) {
                tier = master.getPriorityTier();
            } else {
                throw new InvalidInputException("order " + d.orderId + ": no priority tier for customer " + d.customer);
            }
            String segment = d.segment != null && !d.segment.isBlank()
                    ? d.segment
                    : master != null ? master.getSegment() : UNKNOWN_SEGMENT;
            int period = calendar.periodOf(weekOf(d.week, d.deliveryDate, "order " + d.orderId));
            orders.add(new DemandOrder(d.orderId, d.customer, segment, tier, period, qty));
        }

        LOGGER.info("Input built: {} customers, {} weeks of supply ({} delivery lines), {} orders, first week {}",
                customers.size(), supplies.size(), supplyDtos.size(), orders.size(), calendar.labelOf(1));
        return new AllocationInput(calendar, customers, supplies, orders);
    }

    private static int requireQuantity(Integer quantity, String what) {
        if (quantity == null) {
            throw new InvalidInputException("quantity is missing for " + what);
        }
        return quantity;
    }

    private static String weekOf(String week, String deliveryDate, String what) {
        if (week != null && !week.isBlank()) {
            PeriodCalendar.mondayOf(week);
            return week.trim();
        }
        if (deliveryDate == null || deliveryDate.isBlank()) {
            throw new InvalidInputException("neither week nor delivery date given for " + what);
        }
        try {
            return PeriodCalendar.weekOf(LocalDate.parse(deliveryDate.trim()));
        } catch (DateTimeParseException e) {
            throw new InvalidInputException("malformed delivery date for " + what + ": " + deliveryDate, e);
        }
    }
}
