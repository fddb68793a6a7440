package com.deepansh.trendagent.core;

import com.deepansh.trendagent.config.AgentProperties;
import com.deepansh.trendagent.model.ActionRequest;
import com.deepansh.trendagent.support.StubTool;
import com.deepansh.trendagent.tool.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ActionParserTest {

    private ActionParser parser;

    @BeforeEach
    void setUp() {
        ToolRegistry registry = new ToolRegistry(List.of(
                StubTool.returning("Tavily_Search", "results"),
                StubTool.returning("Google_Trends_MCP", "trends")), new AgentProperties());
        parser = new ActionParser(registry);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Machine learning is a field of AI.",
            "",
            "   ",
            "The word action appears here but no marker",
            "INPUT: something without an action line",
            "ACTION:"
    })
    void parse_noMarker_returnsNoAction(String text) {
        assertThat(parser.parse(text)).isEmpty();
    }

    @Test
    void parse_null_returnsNoAction() {
        assertThat(parser.parse(null)).isEmpty();
    }

    @Test
    void parse_unregisteredTool_returnsNoActionInsteadOfError() {
        assertThat(parser.parse("ACTION: Bing_Search\nINPUT: langchain")).isEmpty();
    }

    @Test
    void parse_registeredTool_extractsNameAndInput() {
        Optional<ActionRequest> action = parser.parse("""
                I should look this up.
                ACTION: Tavily_Search
                INPUT: LangChain latest release
                """);

        assertThat(action).contains(new ActionRequest("Tavily_Search", "LangChain latest release"));
    }

    @Test
    void parse_markersAreCaseInsensitive_andNameIsCanonicalized() {
        Optional<ActionRequest> action = parser.parse("action: google_trends_mcp\ninput: GB");

        assertThat(action).contains(new ActionRequest("Google_Trends_MCP", "GB"));
    }

    @Test
    void parse_missingInput_yieldsEmptyInput() {
        Optional<ActionRequest> action = parser.parse("ACTION: Google_Trends_MCP");

        assertThat(action).isPresent();
        assertThat(action.get().toolInput()).isEmpty();
    }

    @Test
    void parse_inputBlock_spansLinesUntilBlankLine() {
        Optional<ActionRequest> action = parser.parse(
                "ACTION: Tavily_Search\nINPUT:\n  AI regulation\n  in the EU\n\nI will wait for results.");

        assertThat(action).isPresent();
        assertThat(action.get().toolInput()).isEqualTo("AI regulation\nin the EU");
    }

    @Test
    void parse_inlineInput_ignoresProseOnFollowingLines() {
        Optional<ActionRequest> action = parser.parse(
                "ACTION: Tavily_Search\nINPUT: LangChain\nI will then summarise the results.\nThanks!");

        assertThat(action).contains(new ActionRequest("Tavily_Search", "LangChain"));
    }

    @Test
    void parse_inputBlock_stopsAtNextActionMarker() {
        Optional<ActionRequest> action = parser.parse(
                "ACTION: Tavily_Search\nINPUT: first query\nACTION: Google_Trends_MCP\nINPUT: US");

        assertThat(action).contains(new ActionRequest("Tavily_Search", "first query"));
    }

    @Test
    void parse_malformedButIntendedAction_failsOpenWithoutRetry() {
        // Tool name split by a space: clearly meant as a call, still treated as a final answer
        assertThat(parser.parse("ACTION: Tavily Search\nINPUT: news")).isEmpty();
    }
}
