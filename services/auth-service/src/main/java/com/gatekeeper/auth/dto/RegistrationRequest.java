package com.gatekeeper.auth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Candidate credentials for a new local account.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegistrationRequest {

    @NotBlank
    @Size(max = 255)
    private String username;

    /** bcrypt only reads the first 72 bytes. */
    @NotBlank
    @Size(max = 72)
    @ToString.Exclude
    private String password;

    @Size(max = 255)
    private String fullName;

    public RegistrationRequest(String username, String password) {
        this(username, password, null);
    }
}
