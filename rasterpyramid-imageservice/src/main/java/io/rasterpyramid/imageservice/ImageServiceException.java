/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.rasterpyramid.imageservice;

import java.io.IOException;

/**
 * Signals an unusable response from an image service: an HTTP error status, an ArcGIS
 * {@code error} document, or a body that can't be parsed.
 */
public class ImageServiceException extends IOException {

    private static final long serialVersionUID = 1L;

    private final int code;

    public ImageServiceException(String message) {
        this(message, 0);
    }

    public ImageServiceException(String message, int code) {
        super(message);
        this.code = code;
    }

    public ImageServiceException(String message, Throwable cause) {
        super(message, cause);
        this.code = 0;
    }

    /**
     * @return the HTTP status or ArcGIS error code, or {@code 0} if not applicable
     */
    public int getCode() {
        return code;
    }
}
