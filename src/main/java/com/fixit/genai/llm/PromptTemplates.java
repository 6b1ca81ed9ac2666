package com.fixit.genai.llm;

/**
 * Prompt texts sent to the model. Variables use LangChain4j {@code {{name}}} syntax.
 */
public final class PromptTemplates {

    private PromptTemplates() {
    }

    public static final String LEAD_NOTES = """
            You are a real estate sales analyst. Analyze the following lead notes and provide a score
            from 0.0 to 1.0 indicating how likely this lead is to convert, along with specific reasons.

            Lead Notes:
            {{notes}}

            Consider the following factors:
            1. Urgency signals (words like "urgent", "asap", "immediately", timeline mentions)
            2. Buyer intent (serious vs casual, ready to buy vs just browsing)
            3. Financial readiness (budget flexibility, loan approval, cash buyer)
            4. Engagement level (scheduled visits, confirmation, follow-ups)
            5. Red flags (not picking calls, unrealistic expectations, wrong contact)

            Respond in this exact JSON format:
            {
                "score": <float between 0.0 and 1.0>,
                "reasons": ["reason1", "reason2", "reason3"],
                "urgency_level": "<high/medium/low>",
                "buyer_intent": "<strong/moderate/weak>",
                "red_flags": ["flag1", "flag2"] or []
            }
            """;

    public static final String CALL_SYSTEM = """
            You are an expert call quality analyst for a real estate company. Your job is to evaluate
            sales call transcripts and provide structured feedback on agent performance.

            Be objective and fair in your assessment. Consider:
            - The agent's communication skills
            - How well they understood customer needs
            - Their ability to address objections
            - Whether they moved the conversation toward a positive outcome
            - Any compliance or ethical concerns

            Always respond with valid JSON matching the requested format.
            """;

    public static final String CALL_STAGE = """
            Evaluate ONE dimension of the following sales call transcript.

            Dimension: {{dimension}}
            What to look for: {{criteria}}
            Scale: 0.0 to 1.0. {{direction}}

            Call Transcript:
            {{transcript}}

            Respond in this exact JSON format:
            {
                "score": <float 0.0-1.0>,
                "evidence": "<one sentence quoting or paraphrasing the transcript>"
            }
            """;

    public static final String CALL_SUMMARY = """
            A sales call was scored on four dimensions (0.0 to 1.0):
            - rapport_building: {{rapport}}
            - need_discovery: {{needDiscovery}}
            - closing_attempt: {{closing}}
            - compliance_risk: {{compliance}} (lower is better)

            Call Transcript:
            {{transcript}}

            Write a brief summary of the call (2-3 sentences), the key points discussed and the
            recommended next actions for the sales agent.

            Respond in this exact JSON format:
            {
                "summary": "<brief summary>",
                "key_points": ["point1", "point2", "point3"],
                "next_actions": ["action1", "action2"]
            }
            """;
}
