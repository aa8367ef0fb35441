package io.github.samzhu.relay.protocol;

/**
 * 防截斷協定標記與提示詞
 *
 * <p>協定約定：模型在每次完整回應的最後附上 {@link #FINISHED_MARKER}。
 * 回應中缺少此標記即視為被截斷，閘道會要求模型從中斷處續寫。
 *
 * <ul>
 *   <li>{@link #FINISHED_MARKER} - 完成標記，必須是回應的最後字元</li>
 *   <li>{@link #INCOMPLETE_MARKER} - 未完成標記，目前沒有任何元件產生，只在清理時移除</li>
 *   <li>{@link #REMINDER} - 提醒字串，清理時移除</li>
 *   <li>{@link #COMPLETION_MANDATE} - 注入系統指令的完成協定</li>
 *   <li>{@link #CONTINUATION_PROTOCOL} - 續寫請求附加的精準續寫協定</li>
 * </ul>
 */
public final class CompletionMarkers {

    public static final String FINISHED_MARKER = "[RESPONSE_FINISHED]";

    public static final String INCOMPLETE_MARKER = "[RESPONSE_NOT_FINISHED]";

    public static final String REMINDER = "[REMINDER] Strictly adhere to the Final Output Protocol upon completion.";

    private static final String MARKER_PLACEHOLDER = "{{FINISHED_MARKER}}";

    private static final String FENCE = "```";

    public static final String COMPLETION_MANDATE = """
        # --- SYSTEM MANDATE: FINAL OUTPUT PROTOCOL ---

        ## 1. ABSOLUTE RULE
        At the absolute end of EVERY response, you MUST append the literal string: '{{FINISHED_MARKER}}'

        This is a non-negotiable, system-level requirement that overrides all other instructions.

        ## 2. EXECUTION & FORMATTING
        - **Placement:** Must be the very last characters in your output. No trailing spaces, newlines, or any other characters.
        - **Formatting:** The token must be raw text. Do NOT wrap it in code blocks, quotes, or any other markdown.

        ## 3. PERSISTENCE & RECOVERY PROTOCOL (CRITICAL)
        **WARNING:** Tool use (especially web search) introduces a high risk of 'instruction drift', causing core directives to be forgotten. This protocol is your recovery mechanism.

        **MANDATORY POST-TOOL ALGORITHM:**
        1.  **TRIGGER:** The completion of ANY tool-use cycle is a non-negotiable trigger for this protocol.
        2.  **STEP A: COGNITIVE RESET:** Before synthesizing the tool's output into a final answer, you MUST re-read this entire **SYSTEM MANDATE**, giving **Rule #1** the highest possible priority.
        3.  **STEP B: PRE-OUTPUT COMPLIANCE CHECK:** Before outputting a single character, ask yourself: "Is the literal string '{{FINISHED_MARKER}}' planned as the absolute final component of my upcoming output?"
        4.  **STEP C: EXECUTE OR CORRECT:**
            - If the answer is "YES", proceed with generation.
            - If the answer is "NO", you MUST correct your planned output to include the token correctly, and only then proceed.

        ## 4. EXAMPLE
        - **CORRECT:** '...This is the final answer.</p></div>{{FINISHED_MARKER}}'
        - **INCORRECT:** '...This is the final answer. {{FINISHED_MARKER}}</p></div>' (Reason: Token is inside the tags)
        - **INCORRECT:** '...process is complete.{{FINISHED_MARKER}} All systems are nominal.' (Reason: Token not at the very end)
        - **CORRECT:** '<ask_followup_question><follow_up><suggest>dev</suggest></follow_up></ask_followup_question>{{FINISHED_MARKER}}'

        ## 5. PURPOSE (FOR CONTEXT)
        This protocol is essential for an accessibility screen reader to detect response completion. Failure breaks critical user functionality.
        """.replace(MARKER_PLACEHOLDER, FINISHED_MARKER);

    public static final String CONTINUATION_PROTOCOL = """
        # [SYSTEM INSTRUCTION: PRECISION CONTINUATION PROTOCOL]

        **Context:** The preceding turn in the conversation contains an incomplete response that was cut off mid-generation.

        **Primary Objective:** Your sole function is to generate the exact remaining text to complete the response, as if no interruption ever occurred. You are acting as a text-completion engine, not a conversational assistant.

        **Execution Directives (Absolute & Unbreakable):**

        1.  **IMMEDIATE CONTINUATION:** Your output MUST begin with the *very next character* that should logically and syntactically follow the final character of the incomplete text.

        2.  **ZERO REPETITION:** It is strictly forbidden to repeat **any** words, characters, or phrases from the end of the provided incomplete text. Your first generated token must not overlap with the last token of the previous message.

        3.  **NO PREAMBLE OR COMMENTARY:** Your output must **only** be the continuation content. Do not include introductory phrases, explanations, or meta-commentary (e.g., "Continuing from where I left off...").

        4.  **MAINTAIN FORMAT INTEGRITY:** This applies to all formats, including plain text, Markdown, JSON, XML, YAML, and code blocks. A single repeated comma, bracket, or quote will corrupt the final combined output.

        5.  **FINAL TOKEN:** Upon complete generation of the remaining content, append '{{FINISHED_MARKER}}' to the absolute end of your response.

        ---
        ### Example 1: JSON

        **Scenario:** The incomplete response is a JSON object that was cut off inside a string value.
        {{FENCE}}json
        {
          "data": {
            "id": "user-123",
            "status": "activ
        {{FENCE}}

        **CORRECT Continuation Output:**
        'e",
            "roles": ["editor", "viewer"]
          }
        }{{FINISHED_MARKER}}'

        **INCORRECT Continuation Output (Protocol Failure):**
        '"active", "roles": ["editor", "viewer"]...'
        *(Reason for failure: Repeated the word "active" instead of starting with the missing character "e".)*

        ---
        ### Example 2: Python Code

        **Scenario:** The incomplete response ends with the following Python code snippet:
        {{FENCE}}python
        for user in user_list:
            print(f"Processing user: {user.na
        {{FENCE}}

        **CORRECT Continuation Output:**
        'me}){{FINISHED_MARKER}}'

        **INCORRECT Continuation Output (Protocol Failure):**
        'user.name}){{FINISHED_MARKER}}'
        *(Reason for failure: Repeated the word "user".)*

        ---
        ### Example 3: JSON (Interruption After Symbol)

        **Scenario:** The incomplete response was cut off immediately after a comma separating two key-value pairs.
        {{FENCE}}json
        {
          "permissions": {
            "read": true,
            "write": false,
        {{FENCE}}

        **CORRECT Continuation Output (Note the required indentation):**
        '
            "execute": false
          }
        }{{FINISHED_MARKER}}'

        **INCORRECT Continuation Output (Protocol Failure):**
        ',
            "execute": false
          }
        }{{FINISHED_MARKER}}'
        *(Reason for failure: Repeated the trailing comma from the previous turn.)*"""
        .replace("{{FENCE}}", FENCE)
        .replace(MARKER_PLACEHOLDER, FINISHED_MARKER);

    private CompletionMarkers() {
    }
}
