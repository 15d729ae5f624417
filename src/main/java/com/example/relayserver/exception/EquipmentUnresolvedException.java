package com.example.relayserver.exception;

import com.example.relayserver.model.ReviewReason;

/**
 * 文件名与内容都无法推导出设备位号
 */
public class EquipmentUnresolvedException extends RelayExtractionException {

    public EquipmentUnresolvedException(String fileName) {
        super(ReviewReason.EQUIPMENT_UNRESOLVED, "无法确定设备位号: " + fileName);
    }
}
