package com.gateway.checkout.repository;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Composite primary key of {@link SessionVersionRecord}.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class SessionVersionKey implements Serializable {
    private String sessionId;
    private int version;
}
