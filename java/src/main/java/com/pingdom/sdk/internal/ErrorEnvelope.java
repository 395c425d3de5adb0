package com.pingdom.sdk.internal;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire shape of a Pingdom error response: {@code {"error": {"statuscode": 403, "statusdesc": "Forbidden",
 * "errormessage": "..."}}}.
 */
record ErrorEnvelope(@JsonProperty("error") Detail error) {

    record Detail(
        @JsonProperty("statuscode") int statusCode,
        @JsonProperty("statusdesc") String statusDesc,
        @JsonProperty("errormessage") @JsonAlias("message") String message
    ) {
    }
}
