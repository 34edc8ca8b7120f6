package com.flagship.tax_submission.generation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tax_submission.document.Party;
import lombok.Value;

@Value
public class PartyDto {

    @JsonProperty("id_type")
    String idType;

    @JsonProperty("id_number")
    String idNumber;

    @JsonProperty("name")
    String name;

    @JsonProperty("address")
    String address;

    public Party toDomain() {
        return new Party(idType, idNumber, name, address);
    }

    public static PartyDto from(Party party) {
        return party == null ? null
            : new PartyDto(party.getIdType(), party.getIdNumber(), party.getName(), party.getAddress());
    }
}
