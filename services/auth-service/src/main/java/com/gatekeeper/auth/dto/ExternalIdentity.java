package com.gatekeeper.auth.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ExternalIdentity - Claims of a third-party identity that has already been verified.
 *
 * Produced by the OAuth/OIDC callback handler after it has checked the ID
 * token's signature and audience against the provider (Google). This service
 * trusts the values as given.
 *
 * Fields:
 * - email: becomes the local username
 * - name: display name, may be empty
 * - externalId: the provider's stable subject id ({@code sub})
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExternalIdentity {

    @NotBlank
    @Email
    private String email;

    private String name;

    @NotBlank
    private String externalId;
}
