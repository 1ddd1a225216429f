package dk.trustworks.statements.apigateway.resources;

import com.fasterxml.jackson.databind.ObjectMapper;
import dk.trustworks.statements.apigateway.resources.dto.StatementRunRequest;
import dk.trustworks.statements.ledgerservice.fetch.CancellationToken;
import dk.trustworks.statements.statementservice.model.PeriodPreset;
import dk.trustworks.statements.statementservice.model.ProfitAndLoss;
import dk.trustworks.statements.statementservice.model.ReportPeriod;
import dk.trustworks.statements.statementservice.model.ReportRun;
import dk.trustworks.statements.statementservice.services.JsonStatementRenderer;
import dk.trustworks.statements.statementservice.services.ReportRunService;
import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.io.StringWriter;
import java.time.Clock;
import java.time.LocalDate;

import static jakarta.ws.rs.core.MediaType.APPLICATION_JSON;

@JBossLog
@Tag(name = "statements")
@Path("/statements")
@RequestScoped
@Produces(APPLICATION_JSON)
@Consumes(APPLICATION_JSON)
public class StatementResource {

    static final String NDJSON = "application/x-ndjson";

    @Inject
    ReportRunService reportRunService;

    @Inject
    ObjectMapper objectMapper;

    Clock clock = Clock.systemDefaultZone();

    @GET
    public ReportRun runReport(@QueryParam("period") @DefaultValue("MONTHLY") PeriodPreset period,
                               @QueryParam("from") String from,
                               @QueryParam("to") String to,
                               @QueryParam("shape") @DefaultValue("CATEGORIZED") ProfitAndLoss.Shape shape) {
        return run(new StatementRunRequest(period, from, to, shape, null));
    }

    @POST
    @Path("/runs")
    public ReportRun runReport(StatementRunRequest request) {
        return run(request);
    }

    @POST
    @Path("/export")
    @Produces(NDJSON)
    public String export(StatementRunRequest request) {
        ReportRun run = run(request);
        StringWriter out = new StringWriter();
        reportRunService.render(run, new JsonStatementRenderer(out, objectMapper));
        return out.toString();
    }

    private ReportRun run(StatementRunRequest request) {
        if (request == null) throw new IllegalArgumentException("Missing report request");
        PeriodPreset preset = request.period() != null ? request.period() : PeriodPreset.MONTHLY;
        ReportPeriod period = ReportPeriod.of(preset, LocalDate.now(clock), request.from(), request.to());
        ProfitAndLoss.Shape shape = request.shape() != null ? request.shape() : ProfitAndLoss.Shape.CATEGORIZED;
        log.infof("Report requested: %s %s..%s (%s)", preset, period.start(), period.end(), shape);
        return reportRunService.run(period, shape, request.cashFlow(), CancellationToken.none());
    }
}
