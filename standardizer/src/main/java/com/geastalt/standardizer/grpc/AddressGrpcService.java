/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.grpc;

import com.geastalt.standardizer.config.StandardizerConfig;
import com.geastalt.standardizer.grpc.generated.AddressStandardizerServiceGrpc;
import com.geastalt.standardizer.grpc.generated.AddressType;
import com.geastalt.standardizer.grpc.generated.ParseAddressRequest;
import com.geastalt.standardizer.grpc.generated.ParseAddressResponse;
import com.geastalt.standardizer.grpc.generated.StandardizeAddressRequest;
import com.geastalt.standardizer.grpc.generated.StandardizeAddressResponse;
import com.geastalt.standardizer.model.Classification;
import com.geastalt.standardizer.model.ParseResult;
import com.geastalt.standardizer.model.ParsedComponents;
import com.geastalt.standardizer.model.StandardizedAddress;
import com.geastalt.standardizer.service.AddressParsingService;
import com.geastalt.standardizer.service.AddressStandardizationService;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.devh.boot.grpc.server.service.GrpcService;

@Slf4j
@GrpcService
@RequiredArgsConstructor
public class AddressGrpcService extends AddressStandardizerServiceGrpc.AddressStandardizerServiceImplBase {

    private final AddressParsingService parsingService;
    private final AddressStandardizationService standardizationService;
    private final StandardizerConfig config;

    @Override
    public void parse(ParseAddressRequest request,
                      StreamObserver<ParseAddressResponse> responseObserver) {
        String address = request.getAddress().strip();
        if (address.isEmpty()) {
            rejectInvalid(responseObserver, "address is required");
            return;
        }
        if (address.length() > config.getMaxInputLength()) {
            rejectInvalid(responseObserver, "address must be at most " + config.getMaxInputLength() + " characters");
            return;
        }

        ParseResult result = parsingService.parseAndClassify(address);

        ParseAddressResponse.Builder responseBuilder = ParseAddressResponse.newBuilder()
                .setInput(result.input())
                .putAllComponents(result.components().toMap())
                .setType(mapAddressType(result.classification()));
        result.classification().warning().ifPresent(responseBuilder::setWarning);

        responseObserver.onNext(responseBuilder.build());
        responseObserver.onCompleted();
    }

    @Override
    public void standardize(StandardizeAddressRequest request,
                            StreamObserver<StandardizeAddressResponse> responseObserver) {
        ParsedComponents components;
        if (request.getComponentsCount() > 0) {
            components = ParsedComponents.fromMap(request.getComponentsMap());
        } else if (request.hasAddress() && !request.getAddress().isBlank()) {
            String address = request.getAddress().strip();
            if (address.length() > config.getMaxInputLength()) {
                rejectInvalid(responseObserver, "address must be at most " + config.getMaxInputLength() + " characters");
                return;
            }
            components = parsingService.parseAndClassify(address).components();
        } else {
            rejectInvalid(responseObserver, "Provide 'address' (non-empty string) or 'components' (non-empty map).");
            return;
        }

        StandardizedAddress standardized = standardizationService.standardize(components);

        responseObserver.onNext(StandardizeAddressResponse.newBuilder()
                .setAddressLine1(standardized.getAddressLine1())
                .setAddressLine2(standardized.getAddressLine2())
                .setCity(standardized.getCity())
                .setState(standardized.getState())
                .setZipCode(standardized.getZipCode())
                .setStandardized(standardized.getStandardized())
                .putAllComponents(standardized.componentMap())
                .build());
        responseObserver.onCompleted();
    }

    private static void rejectInvalid(StreamObserver<?> responseObserver, String message) {
        log.warn("Rejecting gRPC request: {}", message);
        responseObserver.onError(Status.INVALID_ARGUMENT.withDescription(message).asRuntimeException());
    }

    private static AddressType mapAddressType(Classification classification) {
        if (classification instanceof Classification.Intersection) {
            return AddressType.INTERSECTION;
        }
        if (classification instanceof Classification.Ambiguous) {
            return AddressType.AMBIGUOUS;
        }
        return AddressType.STREET_ADDRESS;
    }
}
