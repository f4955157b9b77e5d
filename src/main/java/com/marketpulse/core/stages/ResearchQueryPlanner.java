package com.marketpulse.core.stages;

import com.marketpulse.core.model.AnalysisRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Expands a request into the web search queries run by the research stage.
 */
@Component
public class ResearchQueryPlanner {

    public List<String> plan(AnalysisRequest request, int maxQueries) {
        String segment = request.segment().trim();
        String product = request.product() == null ? "" : request.product().trim();

        Set<String> queries = new LinkedHashSet<>();
        if (request.query() != null && !request.query().isBlank()) {
            queries.add(request.query().trim());
        }

        if (!product.isEmpty()) {
            queries.add("mercado " + segment + " " + product + " Brasil dados estatísticas crescimento");
            queries.add("análise competitiva " + segment + " " + product + " principais players");
            queries.add("tendências " + segment + " " + product + " inovação tecnologia futuro");
            queries.add("demanda " + product + " Brasil consumo comportamento cliente");
            queries.add("preços " + product + " " + segment + " benchmarks ticket médio");
        } else {
            queries.add("mercado " + segment + " Brasil tamanho crescimento dados");
            queries.add("análise setorial " + segment + " principais empresas líderes");
            queries.add("tendências " + segment + " inovação disrupção futuro");
            queries.add("oportunidades investimento " + segment + " venture capital");
            queries.add("regulamentação " + segment + " mudanças legais impacto");
        }

        queries.add("startups " + segment + " funding investimento");
        queries.add("pesquisa comportamento consumidor " + segment + " Brasil");
        queries.add("cases sucesso " + segment + " empresas brasileiras");
        queries.add("desafios " + segment + " soluções inovadoras");
        queries.add("futuro " + segment + " predições especialistas");
        queries.add("tecnologia " + segment + " automação IA impacto");

        List<String> planned = new ArrayList<>(queries);
        return planned.size() > maxQueries ? planned.subList(0, maxQueries) : planned;
    }
}
