package com.mikov.emailverifier.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for single address validation.
 *
 * @author zahari.mikov
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmailValidationRequest {

    private String email;
}
