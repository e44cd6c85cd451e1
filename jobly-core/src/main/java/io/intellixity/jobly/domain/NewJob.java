package io.intellixity.jobly.domain;

import java.math.BigDecimal;

/** Fields of a job to be created; the id is generated by the store. */
public record NewJob(String title, Integer salary, BigDecimal equity, String companyHandle) {}
