package com.iimsoft.allocation.util;

import com.iimsoft.allocation.domain.PriorityTier;
import com.iimsoft.allocation.domain.ProductType;
import com.iimsoft.allocation.dto.ImportDTOs;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * 生成演示用的输入快照（固定种子可复现）。
 * 每天：90% 概率到一批 A（10..49）、90% 概率到一批 B（10..59）、90% 概率来一张订单（10..89）。
 */
public class MockDataGenerator {

    private static final String[][] CUSTOMER_MASTER = {
            {"Microsoft", "P1", "Data Center"},
            {"Meta", "P1", "Data Center"},
            {"Tesla", "P2", "Automotive"},
            {"Siemens", "P3", "Healthcare"},
            {"Foxconn", "P4", "Industrial"},
            {"Dell", "P5", "Pro Viz"},
            {"ASUS", "P7", "Gaming OEM"},
            {"Best Buy", "P9", "Gaming Retail"},
    };

    private final Random random;

    public MockDataGenerator(long seed) {
        this.random = new Random(seed);
    }

    public static List<ImportDTOs.CustomerDTO> customerMaster() {
        List<ImportDTOs.CustomerDTO> customers = new ArrayList<>();
        for (String[] row : CUSTOMER_MASTER) {
            ImportDTOs.CustomerDTO c = new ImportDTOs.CustomerDTO();
            c.customer = row[0];
            c.priority = PriorityTier.fromCode(row[1]).name();
            c.segment = row[2];
            customers.add(c);
        }
        return customers;
    }

    public ImportDTOs.Root generate(LocalDate start, int weeks) {
        if (weeks <= 0) {
            throw new IllegalArgumentException("weeks must be positive: " + weeks);
        }
        ImportDTOs.Root root = new ImportDTOs.Root();
        root.customers = customerMaster();
        root.supplies = new ArrayList<>();
        root.demands = new ArrayList<>();

        Set<String> usedIds = new HashSet<>();
        int days = weeks * 7;
        for (int i = 0; i < days; i++) {
            LocalDate date = start.plusDays(i);
            String week = PeriodCalendar.weekOf(date);

            if (random.nextDouble() > 0.1) {
                root.supplies.add(supply(week, date, ProductType.SUBCOMPONENT_A, 10 + random.nextInt(40)));
            }
            if (random.nextDouble() > 0.1) {
                root.supplies.add(supply(week, date, ProductType.SUBCOMPONENT_B, 10 + random.nextInt(50)));
            }
            if (random.nextDouble() > 0.1) {
                String[] customer = CUSTOMER_MASTER[random.nextInt(CUSTOMER_MASTER.length)];
                ImportDTOs.DemandDTO d = new ImportDTOs.DemandDTO();
                d.week = week;
                d.deliveryDate = date.toString();
                d.orderId = nextOrderId(usedIds);
                d.customer = customer[0];
                d.productType = "Advanced_Chip";
                d.quantity = 10 + random.nextInt(80);
                root.demands.add(d);
            }
        }
        return root;
    }

    private static ImportDTOs.SupplyDTO supply(String week, LocalDate date, ProductType type, int qty) {
        ImportDTOs.SupplyDTO s = new ImportDTOs.SupplyDTO();
        s.week = week;
        s.deliveryDate = date.toString();
        s.productType = type.name();
        s.quantity = qty;
        return s;
    }

    private String nextOrderId(Set<String> usedIds) {
        String id;
        do {
            id = String.format("ORD-%06X", random.nextInt(0x1000000));
        } while (!usedIds.add(id));
        return id;
    }
}
