package org.livo.warehouse.controller;

import org.livo.warehouse.dto.PageResult;
import org.livo.warehouse.flow.FlowSnapshot;
import org.livo.warehouse.flow.FlowType;
import org.livo.warehouse.flow.TrackingFlowReconstructor;
import org.livo.warehouse.security.ActingUserResolver;
import org.livo.warehouse.util.ResponseUtil;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.Map;

/**
 * Tracking flows, one pair of routes per anchor family:
 * - GET /api/ribbons/ribbon-flows, /api/ribbons/ribbon-flow/{tracking}
 * - GET /api/onlines/online-flows, /api/onlines/online-flow/{tracking}
 */
@RestController
@RequestMapping("/api")
public class FlowController {

    private final TrackingFlowReconstructor reconstructor;
    private final ActingUserResolver actingUserResolver;

    public FlowController(TrackingFlowReconstructor reconstructor, ActingUserResolver actingUserResolver) {
        this.reconstructor = reconstructor;
        this.actingUserResolver = actingUserResolver;
    }

    @GetMapping("/ribbons/ribbon-flows")
    public ResponseEntity<Map<String, Object>> listRibbonFlows(
            @RequestHeader(ActingUserResolver.USER_ID_HEADER) Long userId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) String search) {
        return list(userId, FlowType.RIBBON, page, limit, startDate, endDate, search);
    }

    @GetMapping("/ribbons/ribbon-flow/{tracking}")
    public ResponseEntity<Map<String, Object>> getRibbonFlow(
            @RequestHeader(ActingUserResolver.USER_ID_HEADER) Long userId,
            @PathVariable String tracking) {
        return get(userId, FlowType.RIBBON, tracking);
    }

    @GetMapping("/onlines/online-flows")
    public ResponseEntity<Map<String, Object>> listOnlineFlows(
            @RequestHeader(ActingUserResolver.USER_ID_HEADER) Long userId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) String search) {
        return list(userId, FlowType.ONLINE, page, limit, startDate, endDate, search);
    }

    @GetMapping("/onlines/online-flow/{tracking}")
    public ResponseEntity<Map<String, Object>> getOnlineFlow(
            @RequestHeader(ActingUserResolver.USER_ID_HEADER) Long userId,
            @PathVariable String tracking) {
        return get(userId, FlowType.ONLINE, tracking);
    }

    private ResponseEntity<Map<String, Object>> list(Long userId, FlowType flowType, int page, int limit,
                                                     LocalDate startDate, LocalDate endDate, String search) {
        actingUserResolver.resolve(userId);
        PageResult<FlowSnapshot> flows = reconstructor.list(flowType, startDate, endDate, search, page, limit);
        return ResponseEntity.ok(ResponseUtil.success("Flows retrieved successfully", flows));
    }

    private ResponseEntity<Map<String, Object>> get(Long userId, FlowType flowType, String tracking) {
        actingUserResolver.resolve(userId);
        FlowSnapshot flow = reconstructor.reconstruct(flowType, tracking);
        return ResponseEntity.ok(ResponseUtil.success("Flow retrieved successfully", flow));
    }
}
