package com.tripscout.pojo.research.category;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 签证要求（按护照国家 + 目的地国家查询）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VisaInfo {

    private String passportCountry;

    private String destinationCountry;

    private Boolean visaRequired;

    /** visa_free / visa_on_arrival / evisa / eta / embassy */
    private String visaType;

    private Boolean evisaAvailable;

    /** 办理天数，未知为 null */
    private Integer processingDays;

    /** 费用（美元），未知为 null */
    private Double costUsd;

    private Integer maxStayDays;

    private String notes;
}
