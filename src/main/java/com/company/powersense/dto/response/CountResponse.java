package com.company.powersense.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CountResponse implements Serializable {
    private static final long serialVersionUID = 1L;

    private long count;
}
