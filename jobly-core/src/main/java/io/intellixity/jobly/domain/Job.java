package io.intellixity.jobly.domain;

import java.math.BigDecimal;

public record Job(Integer id, String title, Integer salary, BigDecimal equity, String companyHandle) {}
