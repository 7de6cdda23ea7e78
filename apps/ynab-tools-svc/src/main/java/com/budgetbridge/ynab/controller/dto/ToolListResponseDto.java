package com.budgetbridge.ynab.controller.dto;

import com.budgetbridge.ynab.tools.ToolDescriptor;
import java.util.List;

public record ToolListResponseDto(List<ToolDescriptor> tools) {
}
