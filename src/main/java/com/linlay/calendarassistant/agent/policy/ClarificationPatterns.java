package com.linlay.calendarassistant.agent.policy;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Phrase sets used by {@link PatternClarificationGate}. English, Chinese, Spanish and French.
 */
public record ClarificationPatterns(
        List<Pattern> noAction,
        List<Pattern> schedulingIntent,
        List<Pattern> ambiguousTime
) {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    public ClarificationPatterns {
        noAction = List.copyOf(noAction);
        schedulingIntent = List.copyOf(schedulingIntent);
        ambiguousTime = List.copyOf(ambiguousTime);
    }

    public static ClarificationPatterns defaults() {
        return new ClarificationPatterns(
                compile(
                        "\\b(?:don'?t|do not)\\s+(?:actually\\s+)?(?:book|schedule|create|add|change|edit|move|delete|remove|cancel)\\b",
                        "\\b(?:not yet|hold off|just (?:asking|checking|wondering)|hypothetically|don'?t do anything|before you (?:book|change|do) anything)\\b",
                        "先别|先不要|暂时不要|暂时别|不要(?:真的)?(?:创建|安排|添加|删除|修改|改动|动)|别(?:真的)?(?:创建|安排|添加|删除|修改|动)|只是问问|先确认一下",
                        "\\b(?:no (?:lo |la )?(?:agendes|programes|crees|borres|elimines|cambies)|todav[ií]a no|solo (?:pregunto|estoy preguntando))\\b",
                        "\\b(?:ne (?:le |la |l')?(?:planifie|programme|cr[ée]e|ajoute|supprime|modifie|change) pas|pas encore|juste une question|je demande juste)\\b"
                ),
                compile(
                        "\\b(?:schedule|book|set up|arrange|plan|organi[sz]e|reschedule|block (?:off|out)|put .+ on my calendar|add (?:an? )?(?:event|meeting|appointment|session|reminder)|create (?:an? )?(?:event|meeting|appointment|session)|find (?:a |some )?time|make time)\\b",
                        "安排|预约|预订|预定|约个|约一下|计划|添加|创建|加一个|加个|定个|排个|找时间|找个时间|提醒我|日程",
                        "\\b(?:agenda|agendar|programa|programar|reserva|reservar|organiza|organizar|planifica|planificar)\\b",
                        "\\b(?:planifie|planifier|programme|programmer|r[ée]serve|r[ée]server|organise|organiser)\\b"
                ),
                compile(
                        "\\b(?:sometime|some time|soon|later|whenever|at some point|when i'?m free|when i have time|free slots?|a few times|regularly|occasionally|every now and then|asap|one of these days)\\b",
                        "最近|近期|找时间|找个时间|有空|抽空|改天|过几天|回头|以后|哪天|什么时候|方便的时候|随便",
                        "\\b(?:pronto|alg[uú]n d[ií]a|cuando pueda|cuando tenga tiempo|m[aá]s tarde|en alg[uú]n momento)\\b",
                        "\\b(?:bient[oô]t|un de ces jours|quand je peux|quand j'ai le temps|plus tard|[àa] un moment donn[ée])\\b"
                )
        );
    }

    public boolean matchesNoAction(String text) {
        return matchesAny(noAction, text);
    }

    public boolean matchesSchedulingIntent(String text) {
        return matchesAny(schedulingIntent, text);
    }

    public boolean matchesAmbiguousTime(String text) {
        return matchesAny(ambiguousTime, text);
    }

    private static boolean matchesAny(List<Pattern> patterns, String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compile(String... expressions) {
        return Arrays.stream(expressions)
                .map(expression -> Pattern.compile(expression, FLAGS))
                .toList();
    }
}
