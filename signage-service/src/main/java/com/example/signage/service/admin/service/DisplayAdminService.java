package com.example.signage.service.admin.service;

import com.example.signage.service.admin.dto.DisplayRequest;
import com.example.signage.service.admin.dto.DisplayResponse;
import com.example.signage.service.admin.dto.DisplayStatsResponse;
import com.example.signage.service.admin.mapper.DisplayMapper;
import com.example.signage.shared.exception.ResourceNotFoundException;
import com.example.signage.shared.model.Display;
import com.example.signage.shared.repository.DisplayGroupRepository;
import com.example.signage.shared.repository.DisplayRepository;
import com.example.signage.shared.util.Constants.DisplayStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class DisplayAdminService {

    private final DisplayRepository displayRepository;
    private final DisplayGroupRepository displayGroupRepository;
    private final DisplayMapper displayMapper;
    private final Clock clock;

    @Transactional
    public DisplayResponse createDisplay(DisplayRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Display display = Display.builder()
                .name(request.getName())
                .location(request.getLocation())
                .status(DisplayStatus.OFFLINE.name())
                .createdAt(now)
                .updatedAt(now)
                .build();
        Display saved = displayRepository.save(display);
        log.info("Registered display {} '{}'", saved.getId(), saved.getName());
        return displayMapper.toDisplayResponse(saved, List.of());
    }

    @Transactional(readOnly = true)
    public DisplayResponse getDisplay(Long id) {
        Display display = displayRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Display not found with ID: " + id));
        return displayMapper.toDisplayResponse(display, displayGroupRepository.findGroupIdsByDisplayId(id));
    }

    @Transactional(readOnly = true)
    public List<DisplayResponse> getDisplays() {
        return displayRepository.findAllOrderedByName().stream()
                .map(display -> displayMapper.toDisplayResponse(display,
                        displayGroupRepository.findGroupIdsByDisplayId(display.getId())))
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public DisplayStatsResponse getStats() {
        long online = displayRepository.countByStatus(DisplayStatus.ONLINE.name());
        long total = displayRepository.count();
        return new DisplayStatsResponse(total, online, total - online);
    }
}
