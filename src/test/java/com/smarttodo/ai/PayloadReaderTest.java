package com.smarttodo.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PayloadReaderTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private PayloadReader read(String json) throws Exception {
        JsonNode node = mapper.readTree(json);
        return PayloadReader.of(node);
    }

    @Test
    void priorityMustBeOneToThree() throws Exception {
        assertThat(read("{\"p\": 2}").priority("p")).hasValue(2);
        assertThat(read("{\"p\": \"1\"}").priority("p")).hasValue(1);
        assertThat(read("{\"p\": 0}").priority("p")).isEmpty();
        assertThat(read("{\"p\": 4}").priority("p")).isEmpty();
        assertThat(read("{\"p\": 1.5}").priority("p")).isEmpty();
        assertThat(read("{\"p\": \"high\"}").priority("p")).isEmpty();
        assertThat(read("{}").priority("p")).isEmpty();
    }

    @Test
    void scoresAreClampedIntoUnitRange() throws Exception {
        assertThat(read("{\"s\": 0.8}").score("s")).hasValue(0.8);
        assertThat(read("{\"s\": 1.7}").score("s")).hasValue(1.0);
        assertThat(read("{\"s\": -3}").score("s")).hasValue(0.0);
        assertThat(read("{\"s\": \"0.25\"}").score("s")).hasValue(0.25);
        assertThat(read("{\"s\": null}").score("s")).isEmpty();
        assertThat(read("{\"s\": [1]}").score("s")).isEmpty();
    }

    @Test
    void stringListsKeepOnlyNonBlankText() throws Exception {
        PayloadReader reader = read("{\"k\": [\" budget \", 3, \"\", null, \"Q3\"], \"notList\": \"x\"}");

        assertThat(reader.strings("k")).containsExactly("budget", "Q3");
        assertThat(reader.strings("notList")).isEmpty();
        assertThat(reader.strings("missing")).isEmpty();
    }

    @Test
    void textIgnoresNonTextualValues() throws Exception {
        PayloadReader reader = read("{\"a\": \"  hi \", \"b\": 5, \"c\": \"   \", \"d\": null}");

        assertThat(reader.text("a")).contains("hi");
        assertThat(reader.text("b")).isEmpty();
        assertThat(reader.text("c")).contains("");
        assertThat(reader.nonBlankText("c")).isEmpty();
        assertThat(reader.text("d")).isEmpty();
    }

    @Test
    void objectsSkipsNonObjectElements() throws Exception {
        PayloadReader reader = read("{\"items\": [{\"t\": 1}, \"oops\", {\"t\": 2}]}");

        assertThat(reader.objects("items")).hasSize(2);
    }
}
