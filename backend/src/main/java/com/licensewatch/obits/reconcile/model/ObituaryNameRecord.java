package com.licensewatch.obits.reconcile.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ObituaryNameRecord(
    String firstName,
    String lastName,
    String middleName,
    String nickName,
    String maidenName
) {
    public static ObituaryNameRecord of(String firstName, String lastName) {
        return new ObituaryNameRecord(firstName, lastName, null, null, null);
    }

    public boolean hasMiddleName() {
        return middleName != null && !middleName.isBlank();
    }

    public boolean hasNickName() {
        return nickName != null && !nickName.isBlank();
    }

    public boolean hasMaidenName() {
        return maidenName != null && !maidenName.isBlank();
    }
}
