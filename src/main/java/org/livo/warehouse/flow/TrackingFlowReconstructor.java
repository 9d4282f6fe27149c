package org.livo.warehouse.flow;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import lombok.extern.slf4j.Slf4j;
import org.livo.warehouse.domain.Order;
import org.livo.warehouse.domain.Outbound;
import org.livo.warehouse.domain.QcOnline;
import org.livo.warehouse.domain.QcRibbon;
import org.livo.warehouse.domain.QcStageRecord;
import org.livo.warehouse.domain.User;
import org.livo.warehouse.dto.PageResult;
import org.livo.warehouse.exception.NotFoundException;
import org.livo.warehouse.exception.ValidationFailedException;
import org.livo.warehouse.mapper.OutboundMapper;
import org.livo.warehouse.mapper.QcOnlineMapper;
import org.livo.warehouse.mapper.QcRibbonMapper;
import org.livo.warehouse.service.IOrderService;
import org.livo.warehouse.service.IUserService;
import org.livo.warehouse.util.LikePatternUtil;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only join of QC, outbound and order records by tracking number.
 * <p>
 * The QC record of the requested family is the anchor: without it there is no flow.
 * Outbound and order sections are filled when a record exists and left out otherwise.
 */
@Slf4j
@Service
public class TrackingFlowReconstructor {

    private final QcRibbonMapper qcRibbonMapper;
    private final QcOnlineMapper qcOnlineMapper;
    private final OutboundMapper outboundMapper;
    private final IOrderService orderService;
    private final IUserService userService;

    public TrackingFlowReconstructor(QcRibbonMapper qcRibbonMapper,
                                     QcOnlineMapper qcOnlineMapper,
                                     OutboundMapper outboundMapper,
                                     IOrderService orderService,
                                     IUserService userService) {
        this.qcRibbonMapper = qcRibbonMapper;
        this.qcOnlineMapper = qcOnlineMapper;
        this.outboundMapper = outboundMapper;
        this.orderService = orderService;
        this.userService = userService;
    }

    /**
     * @throws NotFoundException when no anchor record exists for the tracking
     */
    public FlowSnapshot reconstruct(FlowType flowType, String tracking) {
        if (!StringUtils.hasText(tracking)) {
            throw new ValidationFailedException("Tracking number is required");
        }
        FlowSnapshot snapshot = build(flowType, tracking);
        if (snapshot.getQc() == null) {
            throw new NotFoundException("No " + flowType.stageName() + " record found for tracking " + tracking);
        }
        return snapshot;
    }

    /**
     * Page through the anchor family's distinct trackings and rebuild each one.
     *
     * @param startDate first day included, on the anchor's created_at (optional)
     * @param endDate   last day included (optional)
     * @param search    case-insensitive tracking substring (optional)
     */
    public PageResult<FlowSnapshot> list(FlowType flowType, LocalDate startDate, LocalDate endDate,
                                         String search, int page, int pageSize) {
        if (page < 1 || pageSize < 1) {
            throw new ValidationFailedException("page and limit must be positive");
        }
        LocalDateTime from = startDate != null ? startDate.atStartOfDay() : null;
        LocalDateTime until = endDate != null ? endDate.plusDays(1).atStartOfDay() : null;
        String term = StringUtils.hasText(search) ? LikePatternUtil.escape(search.trim()) : null;
        long offset = (long) (page - 1) * pageSize;

        long total;
        List<String> trackings;
        if (flowType == FlowType.RIBBON) {
            total = qcRibbonMapper.countTrackings(from, until, term);
            trackings = qcRibbonMapper.selectTrackingPage(from, until, term, pageSize, offset);
        } else {
            total = qcOnlineMapper.countTrackings(from, until, term);
            trackings = qcOnlineMapper.selectTrackingPage(from, until, term, pageSize, offset);
        }

        List<FlowSnapshot> items = new ArrayList<>(trackings.size());
        for (String tracking : trackings) {
            items.add(build(flowType, tracking));
        }
        log.debug("[Flows listed] flowType={}, page={}, limit={}, total={}, search={}",
                flowType, page, pageSize, total, term);
        return new PageResult<>(items, page, pageSize, total);
    }

    private FlowSnapshot build(FlowType flowType, String tracking) {
        FlowSnapshot snapshot = FlowSnapshot.builder().flowType(flowType).tracking(tracking).build();

        QcStageRecord anchor = findAnchor(flowType, tracking);
        if (anchor != null) {
            snapshot.setQc(FlowSnapshot.QcStage.builder()
                    .operator(operator(anchor.getQcBy()))
                    .createdAt(anchor.getCreatedAt())
                    .build());
        }

        Outbound outbound = outboundMapper.selectOne(new LambdaQueryWrapper<Outbound>()
                .eq(Outbound::getTracking, tracking)
                .last("LIMIT 1"));
        if (outbound != null) {
            snapshot.setOutbound(FlowSnapshot.OutboundStage.builder()
                    .operator(operator(outbound.getOutboundBy()))
                    .expedition(outbound.getExpedition())
                    .expeditionColor(outbound.getExpeditionColor())
                    .createdAt(outbound.getCreatedAt())
                    .build());
        }

        Order order = orderService.getByTracking(tracking);
        if (order != null) {
            snapshot.setOrder(FlowSnapshot.OrderStage.builder()
                    .tracking(order.getTracking())
                    .orderGineeId(order.getOrderGineeId())
                    .complained(Boolean.TRUE.equals(order.getComplained()))
                    .createdAt(order.getCreatedAt())
                    .build());
        }
        return snapshot;
    }

    private QcStageRecord findAnchor(FlowType flowType, String tracking) {
        if (flowType == FlowType.RIBBON) {
            return qcRibbonMapper.selectOne(new LambdaQueryWrapper<QcRibbon>()
                    .eq(QcRibbon::getTracking, tracking)
                    .last("LIMIT 1"));
        }
        return qcOnlineMapper.selectOne(new LambdaQueryWrapper<QcOnline>()
                .eq(QcOnline::getTracking, tracking)
                .last("LIMIT 1"));
    }

    private FlowSnapshot.Operator operator(Long userId) {
        if (userId == null) {
            return null;
        }
        User user = userService.getById(userId);
        if (user == null) {
            return null;
        }
        return new FlowSnapshot.Operator(user.getId(), user.getUsername(), user.getFullName());
    }
}
