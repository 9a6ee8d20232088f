package com.iimsoft.allocation.dto;

import java.util.List;

/**
 * 输入快照的 JSON 结构（一份快照 = 客户主数据 + 子件到货明细 + 订单明细）。
 */
public class ImportDTOs {
    public static class Root {
        public List<CustomerDTO> customers;
        public List<SupplyDTO> supplies;
        public List<DemandDTO> demands;
    }
    public static class CustomerDTO { public String customer, priority, segment; }
    // week 为空时按 deliveryDate 推算 ISO 周
    public static class SupplyDTO { public String week, deliveryDate, productType; public Integer quantity; }
    // priority / segment 为空时取客户主数据
    public static class DemandDTO {
        public String week, deliveryDate, orderId, customer, priority, segment, productType;
        public Integer quantity;
    }
}
