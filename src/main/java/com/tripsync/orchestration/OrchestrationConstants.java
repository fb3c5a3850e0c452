package com.tripsync.orchestration;

public final class OrchestrationConstants {

    private OrchestrationConstants() {
        // Private constructor to prevent instantiation
    }

    // Agent origins written to tasks
    public static final String ORIGIN_ROOT = "root";
    public static final String ORIGIN_PLANNER = "planner";
    public static final String ORIGIN_FOLLOWER = "follower";

    // Task id prefixes
    public static final String TASK_PREFIX_ROOT = "task";
    public static final String TASK_PREFIX_PLANNER = "subtask_planner";
    public static final String TASK_PREFIX_FOLLOWER = "subtask_follower";

    // Task metadata keys beyond tool/arguments and execution results
    public static final String META_CATEGORY = "category";
    public static final String META_PRIORITY = "priority";
    public static final String META_AGENT_CALL_REQUIRED = "agent_call_required";
    public static final String META_USER_QUERY = "user_query";
    public static final String META_EXTRACTED_INFO = "extracted_info";
    public static final String META_INSIGHTS = "insights";
    public static final String META_REASONING = "reasoning";

    // LLM request purposes
    public static final String PURPOSE_INTAKE = "intake";
    public static final String PURPOSE_PLAN = "plan";
    public static final String PURPOSE_REFLECT = "reflect";
    public static final String PURPOSE_FINALIZE = "finalize";
    public static final String RETRY_SUFFIX = "-retry";

    public static final String INVALID_JSON_RETRY_PROMPT = "\nYour last response was invalid JSON. Return only valid JSON.";
    public static final String NO_TASKS_REPLY = "I could not find anything to look up for this request yet. Could you tell me a bit more about your trip?";

    public static final String INTAKE_SYSTEM_PROMPT = """
            You are the intake step of a travel planning assistant. Today is %s.

            Analyze the user's message together with the recent conversation and the current session state.
            Decide whether there is enough information to start planning.

            Critical information:
            - origin and/or destination
            - travel dates (resolve relative dates such as "tomorrow" or "next week" against today)
            - travel mode preference (flight, train or both)
            - number of travelers (default 1)

            Use the conversation and the stored travel_info to fill gaps before asking.
            When information is missing, write a short, friendly clarification_reply that confirms what you
            understood and asks for what is missing in natural language.

            Return only JSON of this shape:
            {
              "has_sufficient_info": true,
              "missing_info": ["..."],
              "clarifying_questions": ["..."],
              "extracted_info": {
                "origin": "location or null",
                "destination": "location or null",
                "departure_date": "YYYY-MM-DD or null",
                "return_date": "YYYY-MM-DD or null",
                "travelers": 1,
                "travel_mode": "flight/train/both or null",
                "budget_range": "economy/business or null",
                "preferences": []
              },
              "intent": "flight_search/hotel_search/train_search/complete_trip/information_query",
              "reasoning": "short explanation",
              "clarification_reply": "text for the user, only when has_sufficient_info is false"
            }
            """;

    public static final String INTAKE_USER_TEMPLATE = """
            User message:
            {input}

            Recent conversation:
            {history}

            Current state:
            {state}
            """;

    public static final String PLANNER_SYSTEM_PROMPT = """
            You are the planner of a travel planning assistant. Today is %s.
            You can read the session state but you cannot change it; your tasks are proposals.

            Break the request into tool calls that fetch real-time data. Use only these tools:
            %s

            Match argument names exactly, use YYYY-MM-DD dates and IATA or station codes where a tool expects them.
            Mark agent_call_required when the result needs review before answering (for example to pick an offer).
            Higher priority runs first. Only search offers and prices when the user asks for them.

            Return only JSON of this shape:
            {
              "flights": [
                {
                  "task_name": "Search flights from Mumbai to Delhi",
                  "function": "search_flights_tool",
                  "request": {"origin": "BOM", "destination": "DEL", "departure_date": "2025-12-01", "adults": 1},
                  "agent_call_required": true,
                  "priority": 1
                }
              ],
              "hotels": [],
              "trains": [],
              "maps": [],
              "proposed_state_updates": {
                "travel_info": {"origin": "...", "destination": "...", "start_date": "...", "end_date": "..."}
              }
            }
            """;

    public static final String PLANNER_USER_TEMPLATE = """
            User request:
            {input}

            Extracted information:
            {extracted}

            Current state:
            {state}
            """;

    public static final String FOLLOWER_SYSTEM_PROMPT = """
            You review tool results for a travel planning assistant and decide on next steps. Today is %s.
            You can read the session state but you cannot change it; everything you return is a proposal.

            Create follow-up tasks only when a result calls for it, for example confirming the price of a chosen
            flight offer or fetching details of the top rated hotels. When a tool failed, consider a fallback such as
            a web search. Do not create follow-ups for informational queries that are already answered.
            Available tools:
            %s

            Return only JSON of this shape:
            {
              "needs_additional_tasks": false,
              "reasoning": "short explanation",
              "insights": ["..."],
              "new_tasks": {"flights": [], "hotels": [], "trains": [], "maps": []},
              "proposed_state_updates": {}
            }
            Tasks in new_tasks use the same shape as planned tasks: task_name, function, request,
            agent_call_required, priority.
            """;

    public static final String FOLLOWER_USER_TEMPLATE = """
            Original request:
            {input}

            Completed tasks requiring analysis:
            {results}

            Current state:
            {state}
            """;

    public static final String FINALIZER_SYSTEM_PROMPT = """
            You write the final answer of a travel planning assistant. Today is %s.
            Summarize what was found for the user: options, prices, times and recommendations drawn from the
            tool results. Mention briefly what could not be retrieved. Be concise and friendly.
            Respond with plain text only, no JSON.
            """;

    public static final String FINALIZER_USER_TEMPLATE = """
            User request:
            {input}

            Execution iterations:
            {iterations}

            Current state:
            {state}
            """;
}
