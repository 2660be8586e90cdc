/*
 * Copyright Splunk Token Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.openshift.splunktoken.api.model.splunktoken;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;

public class SplunkTokenTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    public void testResourceCoordinates() {
        SplunkToken token = new SplunkToken();

        assertThat(token.getApiVersion(), is("splunktoken.managed.openshift.io/v1alpha1"));
        assertThat(token.getKind(), is("SplunkToken"));
        assertThat(SplunkToken.CRD_NAME, is("splunktokens.splunktoken.managed.openshift.io"));
        assertThat(SplunkToken.FINALIZER, is("splunktoken.managed.openshift.io/finalizer"));
    }

    @Test
    public void testSpecWithoutIndexesOmitsEmptyFields() throws Exception {
        assertThat(MAPPER.writeValueAsString(new SplunkTokenSpec("bar", null, null)), is("{\"name\":\"bar\"}"));
        assertThat(MAPPER.writeValueAsString(new SplunkTokenSpec("bar", "", List.of())), is("{\"name\":\"bar\"}"));
    }

    @Test
    public void testSpecKeepsOrderOfAllowedIndexes() throws Exception {
        SplunkTokenSpec spec = new SplunkTokenSpec("bar", "audit_index", List.of("other_index", "audit_index"));

        String json = MAPPER.writeValueAsString(spec);
        assertThat(json, is("{\"name\":\"bar\",\"defaultIndex\":\"audit_index\",\"allowedIndexes\":[\"other_index\",\"audit_index\"]}"));

        SplunkTokenSpec decoded = MAPPER.readValue(json, SplunkTokenSpec.class);
        assertThat(decoded, is(spec));
        assertThat(decoded.getAllowedIndexes(), contains("other_index", "audit_index"));
    }

    @Test
    public void testSpecDecodingIgnoresFieldsManagedBySplunk() throws Exception {
        SplunkTokenSpec spec = MAPPER.readValue("{\"name\":\"bar\",\"disabled\":false,\"useAck\":false}", SplunkTokenSpec.class);

        assertThat(spec.getName(), is("bar"));
    }

    @Test
    public void testTokenIsDecoded() throws Exception {
        String json = "{\"apiVersion\":\"splunktoken.managed.openshift.io/v1alpha1\",\"kind\":\"SplunkToken\","
                + "\"metadata\":{\"name\":\"cluster\",\"namespace\":\"uhc-production-1234\"},"
                + "\"spec\":{\"name\":\"1234\",\"defaultIndex\":\"classic_index\",\"allowedIndexes\":[\"classic_index\"]}}";

        SplunkToken token = MAPPER.readValue(json, SplunkToken.class);

        assertThat(token.getMetadata().getName(), is(SplunkToken.TOKEN_NAME));
        assertThat(token.getSpec().getName(), is("1234"));
        assertThat(token.getSpec().getDefaultIndex(), is("classic_index"));
        assertThat(token.getSpec().getAllowedIndexes(), contains("classic_index"));
    }
}
